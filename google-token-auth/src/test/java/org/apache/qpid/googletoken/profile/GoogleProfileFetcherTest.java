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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.google.common.util.concurrent.MoreExecutors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import org.apache.qpid.googletoken.oauth2.InternalOAuthException;
import org.apache.qpid.googletoken.oauth2.OAuth2Client;
import org.apache.qpid.googletoken.oauth2.OAuth2HttpException;
import org.apache.qpid.googletoken.test.utils.UnitTestBase;
import org.apache.qpid.googletoken.util.ServerScopedRuntimeException;

public class GoogleProfileFetcherTest extends UnitTestBase
{
    private static final URI PROFILE_URI = URI.create("https://www.googleapis.com/oauth2/v3/userinfo");
    private static final String ACCESS_TOKEN = "accessToken";

    private OAuth2Client _client;
    private GoogleProfileFetcher _fetcher;

    @BeforeEach
    public void setUp()
    {
        _client = mock(OAuth2Client.class);
        _fetcher = new GoogleProfileFetcher(_client,
                                            PROFILE_URI,
                                            new GoogleProfileParser(),
                                            MoreExecutors.newDirectExecutorService());
    }

    @Test
    public void testFetchProfile() throws Exception
    {
        when(_client.get(PROFILE_URI, ACCESS_TOKEN)).thenReturn("{\"sub\":\"42\",\"name\":\"Ada Lovelace\"}");

        final GoogleProfile profile = _fetcher.fetchProfile(ACCESS_TOKEN).get(10, TimeUnit.SECONDS);

        assertEquals("42", profile.getId(), "Unexpected id");
        assertEquals("Ada Lovelace", profile.getDisplayName(), "Unexpected display name");
        verify(_client, times(1)).get(eq(PROFILE_URI), eq(ACCESS_TOKEN));
    }

    @Test
    public void testTransportFailureIsWrapped() throws Exception
    {
        final OAuth2HttpException transportFailure = new OAuth2HttpException(401, "{\"error\":\"invalid_token\"}");
        when(_client.get(any(URI.class), any(String.class))).thenThrow(transportFailure);

        final ExecutionException thrown = assertThrows(ExecutionException.class,
                () -> _fetcher.fetchProfile(ACCESS_TOKEN).get(10, TimeUnit.SECONDS));

        final InternalOAuthException cause = assertInstanceOf(InternalOAuthException.class, thrown.getCause());
        assertEquals(GoogleProfileFetcher.FETCH_FAILED_MESSAGE, cause.getMessage(), "Unexpected message");
        assertSame(transportFailure, cause.getCause(), "Original transport error should be the cause");
        verify(_client, times(1)).get(any(URI.class), any(String.class));
    }

    @Test
    public void testTimeoutIsWrapped() throws Exception
    {
        final IOException timeout = new SocketTimeoutException("Read timed out");
        when(_client.get(any(URI.class), any(String.class))).thenThrow(timeout);

        final ExecutionException thrown = assertThrows(ExecutionException.class,
                () -> _fetcher.fetchProfile(ACCESS_TOKEN).get(10, TimeUnit.SECONDS));

        final InternalOAuthException cause = assertInstanceOf(InternalOAuthException.class, thrown.getCause());
        assertSame(timeout, cause.getCause(), "Original timeout should be the cause");
    }

    @Test
    public void testTlsSetupFailureIsWrapped() throws Exception
    {
        final ServerScopedRuntimeException tlsFailure = new ServerScopedRuntimeException("Cannot initialise TLS");
        when(_client.get(any(URI.class), any(String.class))).thenThrow(tlsFailure);

        final ExecutionException thrown = assertThrows(ExecutionException.class,
                () -> _fetcher.fetchProfile(ACCESS_TOKEN).get(10, TimeUnit.SECONDS));

        final InternalOAuthException cause = assertInstanceOf(InternalOAuthException.class, thrown.getCause());
        assertEquals(GoogleProfileFetcher.FETCH_FAILED_MESSAGE, cause.getMessage());
        assertSame(tlsFailure, cause.getCause(), "Original failure should be the cause");
    }

    @Test
    public void testResponseWithTrailingContentIsNotWrapped() throws Exception
    {
        when(_client.get(any(URI.class), any(String.class))).thenReturn("{\"sub\":\"42\"} <html>oops</html>");

        final ExecutionException thrown = assertThrows(ExecutionException.class,
                () -> _fetcher.fetchProfile(ACCESS_TOKEN).get(10, TimeUnit.SECONDS));

        assertInstanceOf(JsonProcessingException.class, thrown.getCause());
    }

    @Test
    public void testMalformedResponseIsNotWrapped() throws Exception
    {
        when(_client.get(any(URI.class), any(String.class))).thenReturn("not json");

        final ExecutionException thrown = assertThrows(ExecutionException.class,
                () -> _fetcher.fetchProfile(ACCESS_TOKEN).get(10, TimeUnit.SECONDS));

        assertInstanceOf(JsonProcessingException.class, thrown.getCause());
    }
}
