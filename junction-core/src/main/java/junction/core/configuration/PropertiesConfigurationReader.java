/*
 * Copyright (c) 2011-2016 Pivotal Software Inc, All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package junction.core.configuration;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link ConfigurationReader} that reads the configuration from properties files
 * and System properties.
 * <p>
 * The default profile, {@code META-INF/junction/default.properties}, is overlaid by the profiles listed in
 * {@code junction.profiles.active}, themselves overlaid by any System property starting with {@code junction.}.
 *
 * @since 1.0
 */
public class PropertiesConfigurationReader implements ConfigurationReader {

	public static final String PROPERTY_NAME_EXECUTOR_TYPE = "junction.executor.type";
	public static final String PROPERTY_NAME_EXECUTOR_SIZE = "junction.executor.size";
	public static final String PROPERTY_NAME_EXECUTOR_NAME = "junction.executor.name";

	private static final String FORMAT_RESOURCE_NAME = "/META-INF/junction/%s.properties";

	private static final String PROPERTY_PREFIX_JUNCTION = "junction.";

	private static final String PROPERTY_NAME_PROFILES_ACTIVE  = "junction.profiles.active";
	private static final String PROPERTY_NAME_PROFILES_DEFAULT = "junction.profiles.default";

	private static final ExecutorType DEFAULT_EXECUTOR_TYPE = ExecutorType.THREAD_POOL;
	private static final String       DEFAULT_EXECUTOR_NAME = "junction";

	private final Logger logger = LoggerFactory.getLogger(getClass());

	private final String defaultProfileNameDefault;

	/**
	 * Creates a new {@code PropertiesConfigurationReader} that, by default, will load its
	 * configuration from {@code META-INF/junction/default.properties}.
	 */
	public PropertiesConfigurationReader() {
		this("default");
	}

	public PropertiesConfigurationReader(String defaultProfileNameDefault) {
		this.defaultProfileNameDefault = defaultProfileNameDefault;
	}

	@Override
	public JunctionConfiguration read() {
		Properties configuration = new Properties();

		applyProfile(loadDefaultProfile(), configuration);

		for (Properties activeProfile : loadActiveProfiles()) {
			applyProfile(activeProfile, configuration);
		}

		applySystemProperties(configuration);

		return new JunctionConfiguration(getExecutorType(configuration),
		                                 getExecutorSize(configuration),
		                                 configuration.getProperty(PROPERTY_NAME_EXECUTOR_NAME, DEFAULT_EXECUTOR_NAME),
		                                 configuration);
	}

	private Properties loadDefaultProfile() {
		String defaultProfileName = System.getProperty(PROPERTY_NAME_PROFILES_DEFAULT, defaultProfileNameDefault);
		return loadProfile(defaultProfileName);
	}

	private List<Properties> loadActiveProfiles() {
		List<Properties> activeProfiles = new ArrayList<Properties>();
		if (null != System.getProperty(PROPERTY_NAME_PROFILES_ACTIVE)) {
			String[] profileNames = System.getProperty(PROPERTY_NAME_PROFILES_ACTIVE).split(",");
			for (String profileName : profileNames) {
				activeProfiles.add(loadProfile(profileName.trim()));
			}
		}
		return activeProfiles;
	}

	private void applyProfile(Properties profile, Properties configuration) {
		configuration.putAll(profile);
	}

	private void applySystemProperties(Properties configuration) {
		for (String prop : System.getProperties().stringPropertyNames()) {
			if (prop.startsWith(PROPERTY_PREFIX_JUNCTION)) {
				configuration.put(prop, System.getProperty(prop));
			}
		}
	}

	private ExecutorType getExecutorType(Properties configuration) {
		String type = configuration.getProperty(PROPERTY_NAME_EXECUTOR_TYPE);
		if (type == null) {
			return DEFAULT_EXECUTOR_TYPE;
		}
		ExecutorType executorType = ExecutorType.fromProperty(type.trim());
		if (executorType == null) {
			logger.warn("The executor type '{}' is not recognized, using '{}'", type,
					DEFAULT_EXECUTOR_TYPE.getPropertyValue());
			return DEFAULT_EXECUTOR_TYPE;
		}
		return executorType;
	}

	private int getExecutorSize(Properties configuration) {
		String property = configuration.getProperty(PROPERTY_NAME_EXECUTOR_SIZE);
		if (property == null) {
			return 0;
		}
		try {
			int size = Integer.parseInt(property.trim());
			if (size >= 0) {
				return size;
			}
		}
		catch (NumberFormatException nfe) {
			logger.debug("Invalid number '{}'", property, nfe);
		}
		logger.warn("The executor size '{}' is not a positive number, using one thread per processor", property);
		return 0;
	}

	protected Properties loadProfile(String name) {
		Properties properties = new Properties();
		String resourceName = String.format(FORMAT_RESOURCE_NAME, name);
		InputStream inputStream = getClass().getResourceAsStream(resourceName);
		if (null != inputStream) {
			try (InputStream in = inputStream) {
				properties.load(in);
			}
			catch (IOException e) {
				logger.error("Failed to load properties from '{}' for profile '{}'", resourceName, name, e);
			}
		}
		else {
			logger.debug("No properties file found in the classpath at '{}' for profile '{}'", resourceName, name);
		}
		return properties;
	}

}
