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
package junction.core.publisher;

/**
 * How a merge reached {@link JunctionState#DONE}.
 *
 * @since 1.0
 */
public final class JunctionOutcome {

	public enum Kind {
		/**
		 * Every source and the source of sources completed and the buffer was drained.
		 */
		COMPLETED,
		/**
		 * A source or the source of sources failed.
		 */
		FAILED,
		/**
		 * The downstream subscriber cancelled before natural completion.
		 */
		KILLED
	}

	static final JunctionOutcome COMPLETED = new JunctionOutcome(Kind.COMPLETED, null);
	static final JunctionOutcome KILLED    = new JunctionOutcome(Kind.KILLED, null);

	static JunctionOutcome failed(Throwable error) {
		return new JunctionOutcome(Kind.FAILED, error);
	}

	private final Kind      kind;
	private final Throwable error;

	private JunctionOutcome(Kind kind, Throwable error) {
		this.kind = kind;
		this.error = error;
	}

	public Kind kind() {
		return kind;
	}

	/**
	 * @return the first failure observed, null unless {@link Kind#FAILED}
	 */
	public Throwable error() {
		return error;
	}

	public boolean isFailure() {
		return kind == Kind.FAILED;
	}

	@Override
	public String toString() {
		return error == null ? kind.name() : kind + "(" + error + ")";
	}
}
