/*
 * Copyright 2026 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.streamrx.controller.dynamodb;

import org.streamrx.cancellation.Cancellations;
import org.streamrx.changestream.FatalTransportException;
import org.streamrx.changestream.RetryableTransportException;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.AbortedException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.dynamodb.model.*;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;

/**
 * Maps AWS SDK errors to transport errors.
 */
final class DynamoDBErrors {

    private DynamoDBErrors() {
    }

    static Throwable translate(Throwable throwable, String operation) {
        Throwable e = throwable instanceof CompletionException && throwable.getCause() != null ? throwable.getCause() : throwable;
        if (e instanceof CancellationException || e instanceof AbortedException) {
            return Cancellations.cancellation(operation + " was cancelled", e);
        } else if (e instanceof ExpiredIteratorException || e instanceof TrimmedDataAccessException) {
            return new FatalTransportException(operation + " failed, the iterator is no longer valid", e);
        } else if (e instanceof ProvisionedThroughputExceededException || e instanceof LimitExceededException
                || e instanceof InternalServerErrorException || e instanceof ResourceNotFoundException) {
            return new RetryableTransportException(operation + " failed: " + e.getMessage(), e);
        } else if (e instanceof AwsServiceException serviceException && (serviceException.isThrottlingException() || serviceException.statusCode() >= 500)) {
            return new RetryableTransportException(operation + " failed: " + e.getMessage(), e);
        } else if (e instanceof SdkClientException) {
            return new RetryableTransportException(operation + " failed: " + e.getMessage(), e);
        }
        return new FatalTransportException(operation + " failed: " + e.getMessage(), e);
    }
}
