package io.etadata.core;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

/// Root of the unchecked errors raised by the data core.
///
/// Every failure in this library aborts the triggering call with the
/// receiving structure left unchanged, so callers can catch this type
/// and keep using the container, schema or sequence they were working on.
public class DataCoreException extends RuntimeException {

    public DataCoreException(String message) {
        super(message);
    }

    public DataCoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
