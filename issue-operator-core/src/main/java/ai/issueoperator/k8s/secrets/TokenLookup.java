/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ai.issueoperator.k8s.secrets;

/** Result of reading the token secret of an IssueRequest. */
public record TokenLookup(State state, String token) {

    public enum State {
        /** The secret does not exist yet and has to be provisioned. */
        NOT_FOUND,
        /** The secret exists but nobody filled in the token yet. */
        EMPTY,
        PRESENT
    }

    public static TokenLookup notFound() {
        return new TokenLookup(State.NOT_FOUND, null);
    }

    public static TokenLookup empty() {
        return new TokenLookup(State.EMPTY, null);
    }

    public static TokenLookup present(String token) {
        return new TokenLookup(State.PRESENT, token);
    }

    public boolean isPresent() {
        return state == State.PRESENT;
    }

    @Override
    public String toString() {
        return "TokenLookup{" + state + "}";
    }
}
