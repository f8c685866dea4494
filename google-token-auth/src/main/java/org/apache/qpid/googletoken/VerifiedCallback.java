/*
 *
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 *
 */
package org.apache.qpid.googletoken;

/**
 * Completion handle given to a verify function. The first invocation decides the outcome of the authentication
 * attempt; any later invocation is ignored.
 *
 * @param <U> application user type
 */
@FunctionalInterface
public interface VerifiedCallback<U>
{
    /**
     * @param error non-null if verification could not be carried out
     * @param user the authenticated user, or {@code null} to reject the credentials
     * @param info auxiliary information passed on with the outcome, may be {@code null}
     */
    void done(Throwable error, U user, Object info);

    default void done(final Throwable error, final U user)
    {
        done(error, user, null);
    }
}
