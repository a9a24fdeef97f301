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
package ai.issueoperator.k8s.controllers;

import io.javaoperatorsdk.operator.processing.retry.GenericRetry;
import io.javaoperatorsdk.operator.processing.retry.GenericRetryExecution;
import io.javaoperatorsdk.operator.processing.retry.Retry;
import io.javaoperatorsdk.operator.processing.retry.RetryExecution;

/** Exponential backoff capped at five minutes, never giving up on a record. */
public class InfiniteRetry implements Retry {

    private static final GenericRetry RETRY =
            new GenericRetry()
                    .setInitialInterval(2000)
                    .setIntervalMultiplier(2.0)
                    .setMaxInterval(300_000)
                    .withoutMaxAttempts();

    @Override
    public RetryExecution initExecution() {
        return new GenericRetryExecution(RETRY);
    }
}
