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
package org.apache.qpid.googletoken.profile;

import java.io.IOException;
import java.net.URI;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.apache.qpid.googletoken.oauth2.InternalOAuthException;
import org.apache.qpid.googletoken.oauth2.OAuth2Client;
import org.apache.qpid.googletoken.util.ServerScopedRuntimeException;

/**
 * Retrieves the profile of the holder of an access token from the userinfo endpoint.
 * <p>
 * Exactly one request is made per fetch; failures are not retried.
 */
public class GoogleProfileFetcher
{
    public static final String FETCH_FAILED_MESSAGE = "Failed to fetch user profile";

    private static final Logger LOGGER = LoggerFactory.getLogger(GoogleProfileFetcher.class);

    private final OAuth2Client _client;
    private final URI _profileEndpointURI;
    private final GoogleProfileParser _parser;
    private final ListeningExecutorService _executor;

    public GoogleProfileFetcher(final OAuth2Client client,
                                final URI profileEndpointURI,
                                final GoogleProfileParser parser,
                                final ListeningExecutorService executor)
    {
        _client = client;
        _profileEndpointURI = profileEndpointURI;
        _parser = parser;
        _executor = executor;
    }

    /**
     * The returned future fails with an {@link InternalOAuthException} if the endpoint could not be called or
     * answered with an error status. A failure to set up TLS for the call counts as a call failure. It fails
     * with the {@link JsonProcessingException} if the response is not a
     * JSON object.
     */
    public ListenableFuture<GoogleProfile> fetchProfile(final String accessToken)
    {
        return _executor.submit(() -> loadProfile(accessToken));
    }

    GoogleProfile loadProfile(final String accessToken) throws JsonProcessingException
    {
        final String body;
        try
        {
            body = _client.get(_profileEndpointURI, accessToken);
        }
        catch (IOException | ServerScopedRuntimeException e)
        {
            LOGGER.error("Call to profile endpoint '{}' failed", _profileEndpointURI, e);
            throw new InternalOAuthException(FETCH_FAILED_MESSAGE, e);
        }

        try
        {
            return _parser.parse(body);
        }
        catch (JsonProcessingException e)
        {
            LOGGER.error("Profile endpoint '{}' did not return a json object", _profileEndpointURI, e);
            throw e;
        }
    }

    public URI getProfileEndpointURI()
    {
        return _profileEndpointURI;
    }
}
