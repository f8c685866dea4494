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
package org.apache.qpid.googletoken.oauth2;

import java.io.IOException;

/**
 * An OAuth2 endpoint answered with a non-successful HTTP status.
 */
public class OAuth2HttpException extends IOException
{
    private static final long serialVersionUID = 1L;

    private final int _statusCode;
    private final String _responseBody;

    public OAuth2HttpException(final int statusCode, final String responseBody)
    {
        super(String.format("OAuth2 endpoint responded with status %d: %s", statusCode, responseBody));
        _statusCode = statusCode;
        _responseBody = responseBody;
    }

    public int getStatusCode()
    {
        return _statusCode;
    }

    public String getResponseBody()
    {
        return _responseBody;
    }
}
