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

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Map;

import javax.net.ssl.TrustManager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.apache.qpid.googletoken.util.IllegalConfigurationException;

/**
 * Immutable configuration of a {@link GoogleTokenStrategy}.
 * <p>
 * Defaults are applied only to options that were not set; an option explicitly set to an empty value keeps that
 * value. Endpoint URLs must be absolute http or https URLs.
 */
public final class GoogleTokenStrategyOptions
{
    private static final Logger LOGGER = LoggerFactory.getLogger(GoogleTokenStrategyOptions.class);

    public static final String CLIENT_ID = "clientID";
    public static final String CLIENT_SECRET = "clientSecret";
    public static final String AUTHORIZATION_URL = "authorizationURL";
    public static final String TOKEN_URL = "tokenURL";
    public static final String PROFILE_URL = "profileURL";
    public static final String GOOGLE_API_VERSION = "gApiVersion";
    public static final String CODE_FIELD = "codeField";
    public static final String ACCESS_TOKEN_FIELD = "accessTokenField";
    public static final String REFRESH_TOKEN_FIELD = "refreshTokenField";
    public static final String PASS_REQ_TO_CALLBACK = "passReqToCallback";
    public static final String CONNECT_TIMEOUT = "connectTimeout";
    public static final String READ_TIMEOUT = "readTimeout";

    public static final String DEFAULT_AUTHORIZATION_URL = "https://accounts.google.com/o/oauth2/auth";
    public static final String DEFAULT_TOKEN_URL = "https://accounts.google.com/o/oauth2/token";
    public static final String PROFILE_URL_FORMAT = "https://www.googleapis.com/oauth2/%s/userinfo";
    public static final String DEFAULT_GOOGLE_API_VERSION = "v3";
    public static final String DEFAULT_CODE_FIELD = "code";
    public static final String DEFAULT_ACCESS_TOKEN_FIELD = "access_token";
    public static final String DEFAULT_REFRESH_TOKEN_FIELD = "refresh_token";

    public static final String GOOGLETOKEN_OAUTH2_CONNECT_TIMEOUT = "qpid.googletoken.oauth2.connectTimeout";
    public static final int DEFAULT_GOOGLETOKEN_OAUTH2_CONNECT_TIMEOUT = 60000;

    public static final String GOOGLETOKEN_OAUTH2_READ_TIMEOUT = "qpid.googletoken.oauth2.readTimeout";
    public static final int DEFAULT_GOOGLETOKEN_OAUTH2_READ_TIMEOUT = 60000;

    private final String _clientId;
    private final String _clientSecret;
    private final URI _authorizationURL;
    private final URI _tokenURL;
    private final URI _profileURL;
    private final String _googleApiVersion;
    private final String _codeField;
    private final String _accessTokenField;
    private final String _refreshTokenField;
    private final boolean _passReqToCallback;
    private final int _connectTimeout;
    private final int _readTimeout;
    private final TrustManager[] _trustManagers;

    private GoogleTokenStrategyOptions(final Builder builder)
    {
        if (builder._clientId == null || builder._clientId.isEmpty())
        {
            throw new IllegalConfigurationException(String.format("'%s' is required", CLIENT_ID));
        }
        if (builder._clientSecret == null)
        {
            throw new IllegalConfigurationException(String.format("'%s' is required", CLIENT_SECRET));
        }
        _clientId = builder._clientId;
        _clientSecret = builder._clientSecret;
        _googleApiVersion = valueOrDefault(builder._googleApiVersion, DEFAULT_GOOGLE_API_VERSION);
        _authorizationURL = toEndpointURI(AUTHORIZATION_URL,
                                          valueOrDefault(builder._authorizationURL, DEFAULT_AUTHORIZATION_URL));
        _tokenURL = toEndpointURI(TOKEN_URL, valueOrDefault(builder._tokenURL, DEFAULT_TOKEN_URL));
        _profileURL = toEndpointURI(PROFILE_URL,
                                    valueOrDefault(builder._profileURL,
                                                   String.format(PROFILE_URL_FORMAT, _googleApiVersion)));
        _codeField = valueOrDefault(builder._codeField, DEFAULT_CODE_FIELD);
        _accessTokenField = valueOrDefault(builder._accessTokenField, DEFAULT_ACCESS_TOKEN_FIELD);
        _refreshTokenField = valueOrDefault(builder._refreshTokenField, DEFAULT_REFRESH_TOKEN_FIELD);
        _passReqToCallback = builder._passReqToCallback;
        _connectTimeout = timeout(CONNECT_TIMEOUT, builder._connectTimeout,
                                  GOOGLETOKEN_OAUTH2_CONNECT_TIMEOUT, DEFAULT_GOOGLETOKEN_OAUTH2_CONNECT_TIMEOUT);
        _readTimeout = timeout(READ_TIMEOUT, builder._readTimeout,
                               GOOGLETOKEN_OAUTH2_READ_TIMEOUT, DEFAULT_GOOGLETOKEN_OAUTH2_READ_TIMEOUT);
        _trustManagers = builder._trustManagers == null ? null : builder._trustManagers.clone();
    }

    public static Builder builder()
    {
        return new Builder();
    }

    /**
     * Creates options from an attribute map keyed by the option names ({@link #CLIENT_ID}, {@link #PROFILE_URL}
     * and so on). Boolean and integer options may be given either typed or as strings. Unrecognised attributes
     * are ignored.
     */
    public static GoogleTokenStrategyOptions fromAttributes(final Map<String, Object> attributes)
    {
        final Builder builder = builder();
        for (Map.Entry<String, Object> attribute : attributes.entrySet())
        {
            final String name = attribute.getKey();
            final Object value = attribute.getValue();
            if (value == null)
            {
                continue;
            }
            switch (name)
            {
                case CLIENT_ID:
                    builder.clientId(String.valueOf(value));
                    break;
                case CLIENT_SECRET:
                    builder.clientSecret(String.valueOf(value));
                    break;
                case AUTHORIZATION_URL:
                    builder.authorizationURL(String.valueOf(value));
                    break;
                case TOKEN_URL:
                    builder.tokenURL(String.valueOf(value));
                    break;
                case PROFILE_URL:
                    builder.profileURL(String.valueOf(value));
                    break;
                case GOOGLE_API_VERSION:
                    builder.googleApiVersion(String.valueOf(value));
                    break;
                case CODE_FIELD:
                    builder.codeField(String.valueOf(value));
                    break;
                case ACCESS_TOKEN_FIELD:
                    builder.accessTokenField(String.valueOf(value));
                    break;
                case REFRESH_TOKEN_FIELD:
                    builder.refreshTokenField(String.valueOf(value));
                    break;
                case PASS_REQ_TO_CALLBACK:
                    builder.passReqToCallback(toBoolean(name, value));
                    break;
                case CONNECT_TIMEOUT:
                    builder.connectTimeout(toInteger(name, value));
                    break;
                case READ_TIMEOUT:
                    builder.readTimeout(toInteger(name, value));
                    break;
                default:
                    LOGGER.warn("Ignoring unrecognised option '{}'", name);
            }
        }
        return builder.build();
    }

    public String getClientId()
    {
        return _clientId;
    }

    public String getClientSecret()
    {
        return _clientSecret;
    }

    public URI getAuthorizationURL()
    {
        return _authorizationURL;
    }

    public URI getTokenURL()
    {
        return _tokenURL;
    }

    public URI getProfileURL()
    {
        return _profileURL;
    }

    public String getGoogleApiVersion()
    {
        return _googleApiVersion;
    }

    public String getCodeField()
    {
        return _codeField;
    }

    public String getAccessTokenField()
    {
        return _accessTokenField;
    }

    public String getRefreshTokenField()
    {
        return _refreshTokenField;
    }

    public boolean isPassReqToCallback()
    {
        return _passReqToCallback;
    }

    public int getConnectTimeout()
    {
        return _connectTimeout;
    }

    public int getReadTimeout()
    {
        return _readTimeout;
    }

    public TrustManager[] getTrustManagers()
    {
        return _trustManagers == null ? null : _trustManagers.clone();
    }

    @Override
    public String toString()
    {
        return "GoogleTokenStrategyOptions{" +
               "clientID='" + _clientId + '\'' +
               ", authorizationURL=" + _authorizationURL +
               ", tokenURL=" + _tokenURL +
               ", profileURL=" + _profileURL +
               ", accessTokenField='" + _accessTokenField + '\'' +
               ", refreshTokenField='" + _refreshTokenField + '\'' +
               ", passReqToCallback=" + _passReqToCallback +
               '}';
    }

    private static String valueOrDefault(final String value, final String defaultValue)
    {
        return value == null ? defaultValue : value;
    }

    private static URI toEndpointURI(final String option, final String value)
    {
        final URI uri;
        try
        {
            uri = new URI(value);
        }
        catch (URISyntaxException e)
        {
            throw new IllegalConfigurationException(String.format("Option '%s' is not a valid URL: '%s'", option, value), e);
        }
        final String scheme = uri.getScheme();
        if (!uri.isAbsolute() || uri.getHost() == null || !("https".equals(scheme) || "http".equals(scheme)))
        {
            throw new IllegalConfigurationException(String.format("Option '%s' is not an absolute http or https URL: '%s'",
                                                                  option, value));
        }
        return uri;
    }

    private static int timeout(final String option,
                               final Integer value,
                               final String systemProperty,
                               final int defaultValue)
    {
        final int timeout = value == null ? Integer.getInteger(systemProperty, defaultValue) : value;
        if (timeout < 0)
        {
            throw new IllegalConfigurationException(String.format("Option '%s' cannot be negative: %d", option, timeout));
        }
        return timeout;
    }

    private static boolean toBoolean(final String option, final Object value)
    {
        if (value instanceof Boolean)
        {
            return (Boolean) value;
        }
        final String stringValue = String.valueOf(value);
        if ("true".equalsIgnoreCase(stringValue) || "false".equalsIgnoreCase(stringValue))
        {
            return Boolean.parseBoolean(stringValue);
        }
        throw new IllegalConfigurationException(String.format("Option '%s' is not a boolean: '%s'", option, value));
    }

    private static int toInteger(final String option, final Object value)
    {
        if (value instanceof Number)
        {
            return ((Number) value).intValue();
        }
        try
        {
            return Integer.parseInt(String.valueOf(value).trim());
        }
        catch (NumberFormatException e)
        {
            throw new IllegalConfigurationException(String.format("Option '%s' is not an integer: '%s'", option, value), e);
        }
    }

    public static final class Builder
    {
        private String _clientId;
        private String _clientSecret;
        private String _authorizationURL;
        private String _tokenURL;
        private String _profileURL;
        private String _googleApiVersion;
        private String _codeField;
        private String _accessTokenField;
        private String _refreshTokenField;
        private boolean _passReqToCallback;
        private Integer _connectTimeout;
        private Integer _readTimeout;
        private TrustManager[] _trustManagers;

        private Builder()
        {
        }

        public Builder clientId(final String clientId)
        {
            _clientId = clientId;
            return this;
        }

        public Builder clientSecret(final String clientSecret)
        {
            _clientSecret = clientSecret;
            return this;
        }

        public Builder authorizationURL(final String authorizationURL)
        {
            _authorizationURL = authorizationURL;
            return this;
        }

        public Builder tokenURL(final String tokenURL)
        {
            _tokenURL = tokenURL;
            return this;
        }

        public Builder profileURL(final String profileURL)
        {
            _profileURL = profileURL;
            return this;
        }

        /**
         * Version of the userinfo API used to build the default profile URL. Ignored when a profile URL is set.
         */
        public Builder googleApiVersion(final String googleApiVersion)
        {
            _googleApiVersion = googleApiVersion;
            return this;
        }

        public Builder codeField(final String codeField)
        {
            _codeField = codeField;
            return this;
        }

        public Builder accessTokenField(final String accessTokenField)
        {
            _accessTokenField = accessTokenField;
            return this;
        }

        public Builder refreshTokenField(final String refreshTokenField)
        {
            _refreshTokenField = refreshTokenField;
            return this;
        }

        public Builder passReqToCallback(final boolean passReqToCallback)
        {
            _passReqToCallback = passReqToCallback;
            return this;
        }

        public Builder connectTimeout(final int connectTimeout)
        {
            _connectTimeout = connectTimeout;
            return this;
        }

        public Builder readTimeout(final int readTimeout)
        {
            _readTimeout = readTimeout;
            return this;
        }

        public Builder trustManagers(final TrustManager[] trustManagers)
        {
            _trustManagers = trustManagers;
            return this;
        }

        public GoogleTokenStrategyOptions build()
        {
            return new GoogleTokenStrategyOptions(this);
        }
    }
}
