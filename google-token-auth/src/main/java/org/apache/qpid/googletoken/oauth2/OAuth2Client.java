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

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.URL;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import javax.net.ssl.TrustManager;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.apache.qpid.googletoken.util.ConnectionBuilder;
import org.apache.qpid.googletoken.util.ExternalServiceException;
import org.apache.qpid.googletoken.util.ExternalServiceTimeoutException;

/**
 * Generic OAuth 2.0 client side operations: building the authorization URL, exchanging an authorization code
 * at the token endpoint and issuing GETs authenticated with an access token.
 * <p>
 * Instances are safe for concurrent use once configured.
 */
public class OAuth2Client
{
    public static final String ACCESS_TOKEN_PARAMETER = "access_token";

    private static final Logger LOGGER = LoggerFactory.getLogger(OAuth2Client.class);
    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<Map<String, Object>>()
    {
    };

    private final ObjectMapper _objectMapper = new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private final String _clientId;
    private final String _clientSecret;
    private final URI _authorizationEndpointURI;
    private final URI _tokenEndpointURI;
    private final int _connectTimeout;
    private final int _readTimeout;
    private final TrustManager[] _trustManagers;

    private volatile boolean _useAuthorizationHeaderForGET = true;

    public OAuth2Client(final String clientId,
                        final String clientSecret,
                        final URI authorizationEndpointURI,
                        final URI tokenEndpointURI,
                        final int connectTimeout,
                        final int readTimeout,
                        final TrustManager[] trustManagers)
    {
        _clientId = clientId;
        _clientSecret = clientSecret;
        _authorizationEndpointURI = authorizationEndpointURI;
        _tokenEndpointURI = tokenEndpointURI;
        _connectTimeout = connectTimeout;
        _readTimeout = readTimeout;
        _trustManagers = trustManagers;
    }

    /**
     * When disabled, {@link #get(URI, String)} passes the access token as the {@code access_token} query
     * parameter instead of an {@code Authorization: Bearer} header.
     */
    public void setUseAuthorizationHeaderForGET(final boolean useAuthorizationHeaderForGET)
    {
        _useAuthorizationHeaderForGET = useAuthorizationHeaderForGET;
    }

    public boolean isUseAuthorizationHeaderForGET()
    {
        return _useAuthorizationHeaderForGET;
    }

    public URI getAuthorizeUrl(final String redirectUri, final String scope)
    {
        final Map<String, String> parameters = new LinkedHashMap<>();
        parameters.put("response_type", "code");
        parameters.put("client_id", _clientId);
        if (redirectUri != null)
        {
            parameters.put("redirect_uri", redirectUri);
        }
        if (scope != null && !scope.isEmpty())
        {
            parameters.put("scope", scope);
        }
        return OAuth2Utils.appendQuery(_authorizationEndpointURI, parameters);
    }

    /**
     * Performs a GET against {@code endpoint} on behalf of the holder of {@code accessToken}.
     *
     * @return the response body
     * @throws OAuth2HttpException if the endpoint answers with a non-2xx status
     * @throws IOException if the endpoint cannot be reached or read from
     */
    public String get(final URI endpoint, final String accessToken) throws IOException
    {
        final URI target = _useAuthorizationHeaderForGET
                ? endpoint
                : OAuth2Utils.appendQuery(endpoint, Collections.singletonMap(ACCESS_TOKEN_PARAMETER, accessToken));

        LOGGER.debug("About to call endpoint '{}'", endpoint);
        final HttpURLConnection connection = newConnection(target.toURL());
        connection.setRequestProperty("Accept-Charset", UTF_8.name());
        connection.setRequestProperty("Accept", "application/json");
        if (_useAuthorizationHeaderForGET)
        {
            connection.setRequestProperty("Authorization", "Bearer " + accessToken);
        }
        connection.connect();

        try (InputStream input = OAuth2Utils.getResponseStream(connection))
        {
            final int responseCode = connection.getResponseCode();
            final String body = new String(input.readAllBytes(), UTF_8);
            LOGGER.debug("Call to endpoint '{}' complete, response code : {}", endpoint, responseCode);
            if (!OAuth2Utils.isSuccessful(responseCode))
            {
                throw new OAuth2HttpException(responseCode, body);
            }
            return body;
        }
        finally
        {
            connection.disconnect();
        }
    }

    /**
     * Exchanges an authorization code grant for an access token at the token endpoint.
     *
     * @throws OAuth2HttpException if the token endpoint rejects the grant
     * @throws ExternalServiceException if the token endpoint response cannot be understood
     * @throws IOException if the token endpoint cannot be reached or read from
     */
    public OAuth2AccessTokenResponse getOAuthAccessToken(final String authorizationCode,
                                                        final String redirectUri) throws IOException
    {
        final Map<String, String> requestBody = new LinkedHashMap<>();
        requestBody.put("client_id", _clientId);
        if (_clientSecret != null && !_clientSecret.isEmpty())
        {
            requestBody.put("client_secret", _clientSecret);
        }
        requestBody.put("code", authorizationCode);
        if (redirectUri != null)
        {
            requestBody.put("redirect_uri", redirectUri);
        }
        requestBody.put("grant_type", "authorization_code");
        final byte[] body = OAuth2Utils.buildRequestQuery(requestBody).getBytes(UTF_8);

        final URL tokenEndpoint = _tokenEndpointURI.toURL();
        LOGGER.debug("About to call token endpoint '{}'", tokenEndpoint);
        final HttpURLConnection connection = newConnection(tokenEndpoint);
        connection.setDoOutput(true);
        connection.setRequestMethod("POST");
        connection.setRequestProperty("Accept-Charset", UTF_8.name());
        connection.setRequestProperty("Content-Type", "application/x-www-form-urlencoded;charset=" + UTF_8.name());
        connection.setRequestProperty("Accept", "application/json");

        try
        {
            connection.connect();
            try (OutputStream output = connection.getOutputStream())
            {
                output.write(body);
            }

            try (InputStream input = OAuth2Utils.getResponseStream(connection))
            {
                final int responseCode = connection.getResponseCode();
                final String responseBody = new String(input.readAllBytes(), UTF_8);
                LOGGER.debug("Call to token endpoint '{}' complete, response code : {}", tokenEndpoint, responseCode);

                final Map<String, Object> responseMap = _objectMapper.readValue(responseBody, JSON_OBJECT);
                if (responseMap == null)
                {
                    throw new ExternalServiceException(String.format("Token endpoint '%s' did not return a json object",
                                                                     tokenEndpoint));
                }
                if (!OAuth2Utils.isSuccessful(responseCode) || responseMap.containsKey("error"))
                {
                    LOGGER.error("Token endpoint failed, response code {}, error '{}', description '{}'",
                                 responseCode, responseMap.get("error"), responseMap.get("error_description"));
                    throw new OAuth2HttpException(responseCode, responseBody);
                }

                final Object accessToken = responseMap.get(ACCESS_TOKEN_PARAMETER);
                if (accessToken == null)
                {
                    throw new ExternalServiceException("Token endpoint response did not include 'access_token'");
                }
                final Object refreshToken = responseMap.get("refresh_token");
                return new OAuth2AccessTokenResponse(String.valueOf(accessToken),
                                                     refreshToken == null ? null : String.valueOf(refreshToken),
                                                     responseMap);
            }
        }
        catch (JsonProcessingException e)
        {
            throw new ExternalServiceException(String.format("Token endpoint '%s' did not return json", tokenEndpoint), e);
        }
        catch (SocketTimeoutException e)
        {
            throw new ExternalServiceTimeoutException(String.format("Timed out calling token endpoint '%s'", tokenEndpoint), e);
        }
        finally
        {
            connection.disconnect();
        }
    }

    public String getClientId()
    {
        return _clientId;
    }

    public URI getAuthorizationEndpointURI()
    {
        return _authorizationEndpointURI;
    }

    public URI getTokenEndpointURI()
    {
        return _tokenEndpointURI;
    }

    private HttpURLConnection newConnection(final URL url) throws IOException
    {
        return new ConnectionBuilder(url).setConnectTimeout(_connectTimeout)
                                         .setReadTimeout(_readTimeout)
                                         .setTrustManagers(_trustManagers)
                                         .build();
    }
}
