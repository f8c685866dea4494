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

import java.util.Collections;
import java.util.Optional;
import java.util.concurrent.Executors;

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.SettableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.apache.qpid.googletoken.oauth2.OAuth2Client;
import org.apache.qpid.googletoken.profile.GoogleProfile;
import org.apache.qpid.googletoken.profile.GoogleProfileFetcher;
import org.apache.qpid.googletoken.profile.GoogleProfileParser;
import org.apache.qpid.googletoken.request.ResolvedTokens;
import org.apache.qpid.googletoken.request.TokenRequest;
import org.apache.qpid.googletoken.request.TokenResolver;
import org.apache.qpid.googletoken.util.DaemonThreadFactory;
import org.apache.qpid.googletoken.util.IllegalConfigurationException;

/**
 * Authenticates requests carrying a Google OAuth 2.0 access token.
 * <p>
 * The token is looked up in the request, exchanged for the user's profile at the userinfo endpoint and handed,
 * together with the normalised profile, to the application's verify function. The verify function's verdict
 * becomes the {@link AuthenticationOutcome} of the attempt:
 * <ul>
 *     <li>no access token in the request: {@code FAILURE} with a message naming the expected field</li>
 *     <li>profile cannot be fetched or parsed: {@code ERROR}</li>
 *     <li>{@code done(error, ...)}: {@code ERROR}</li>
 *     <li>{@code done(null, null, info)}: {@code FAILURE} carrying {@code info}</li>
 *     <li>{@code done(null, user, info)}: {@code SUCCESS}</li>
 * </ul>
 * Attempts are independent; the strategy holds no per-request state and may be used concurrently.
 *
 * @param <U> application user type
 */
public class GoogleTokenStrategy<U> implements AutoCloseable
{
    public static final String NAME = "google-token";

    static final String MISSING_TOKEN_MESSAGE_FORMAT = "You should provide %s";

    private static final Logger LOGGER = LoggerFactory.getLogger(GoogleTokenStrategy.class);

    private final GoogleTokenStrategyOptions _options;
    private final OAuth2Client _oauth2Client;
    private final TokenResolver _tokenResolver;
    private final GoogleProfileFetcher _profileFetcher;
    private final RequestVerifyFunction<U> _verifyFunction;
    private final ListeningExecutorService _executor;
    private final boolean _ownsExecutor;

    public GoogleTokenStrategy(final GoogleTokenStrategyOptions options, final VerifyFunction<U> verifyFunction)
    {
        this(options, verifyFunction, null);
    }

    public GoogleTokenStrategy(final GoogleTokenStrategyOptions options,
                               final VerifyFunction<U> verifyFunction,
                               final ListeningExecutorService executor)
    {
        this(options, createOAuth2Client(options), adapt(verifyFunction), false, executor);
    }

    public GoogleTokenStrategy(final GoogleTokenStrategyOptions options, final RequestVerifyFunction<U> verifyFunction)
    {
        this(options, verifyFunction, null);
    }

    public GoogleTokenStrategy(final GoogleTokenStrategyOptions options,
                               final RequestVerifyFunction<U> verifyFunction,
                               final ListeningExecutorService executor)
    {
        this(options, createOAuth2Client(options), verifyFunction, true, executor);
    }

    GoogleTokenStrategy(final GoogleTokenStrategyOptions options,
                        final OAuth2Client oauth2Client,
                        final RequestVerifyFunction<U> verifyFunction,
                        final boolean requestAware,
                        final ListeningExecutorService executor)
    {
        if (verifyFunction == null)
        {
            throw new IllegalConfigurationException("A verify function is required");
        }
        if (requestAware != options.isPassReqToCallback())
        {
            throw new IllegalConfigurationException(requestAware
                    ? "A request aware verify function requires 'passReqToCallback' to be enabled"
                    : "'passReqToCallback' requires a request aware verify function");
        }
        _options = options;
        _oauth2Client = oauth2Client;
        _oauth2Client.setUseAuthorizationHeaderForGET(false);
        _verifyFunction = verifyFunction;
        _ownsExecutor = executor == null;
        _executor = executor == null
                ? MoreExecutors.listeningDecorator(Executors.newCachedThreadPool(new DaemonThreadFactory(NAME + "-profile")))
                : executor;
        _tokenResolver = new TokenResolver(options.getAccessTokenField(), options.getRefreshTokenField());
        _profileFetcher = new GoogleProfileFetcher(_oauth2Client, options.getProfileURL(), new GoogleProfileParser(), _executor);
    }

    public String getName()
    {
        return NAME;
    }

    /**
     * Authenticates a single request. The returned future always completes with an outcome, never exceptionally,
     * once the verify function has invoked its callback.
     */
    public ListenableFuture<AuthenticationOutcome<U>> authenticate(final TokenRequest request)
    {
        final Optional<ResolvedTokens> resolvedTokens = _tokenResolver.resolve(request);
        if (resolvedTokens.isEmpty())
        {
            LOGGER.debug("Request does not provide '{}'", _options.getAccessTokenField());
            final String message = String.format(MISSING_TOKEN_MESSAGE_FORMAT, _options.getAccessTokenField());
            return Futures.immediateFuture(AuthenticationOutcome.failure(Collections.singletonMap("message", message)));
        }

        final ResolvedTokens tokens = resolvedTokens.get();
        final ListenableFuture<GoogleProfile> profile = _profileFetcher.fetchProfile(tokens.getAccessToken());
        final ListenableFuture<AuthenticationOutcome<U>> verified =
                Futures.transformAsync(profile,
                                       fetchedProfile -> verify(request, tokens, fetchedProfile),
                                       MoreExecutors.directExecutor());
        return Futures.catching(verified,
                                Throwable.class,
                                cause ->
                                {
                                    LOGGER.debug("Authentication attempt ended with an error", cause);
                                    return AuthenticationOutcome.<U>error(cause);
                                },
                                MoreExecutors.directExecutor());
    }

    private ListenableFuture<AuthenticationOutcome<U>> verify(final TokenRequest request,
                                                              final ResolvedTokens tokens,
                                                              final GoogleProfile profile)
    {
        final SettableFuture<AuthenticationOutcome<U>> outcome = SettableFuture.create();
        final VerifiedCallback<U> done = (error, user, info) ->
        {
            final AuthenticationOutcome<U> result;
            if (error != null)
            {
                result = AuthenticationOutcome.error(error);
            }
            else if (user == null)
            {
                result = AuthenticationOutcome.failure(info);
            }
            else
            {
                result = AuthenticationOutcome.success(user, info);
            }

            if (!outcome.set(result))
            {
                LOGGER.warn("Verify function completed more than once for profile '{}', ignoring {} outcome",
                            profile.getId(), result.getStatus());
            }
        };

        try
        {
            _verifyFunction.verify(request,
                                   tokens.getAccessToken(),
                                   tokens.getRefreshToken().orElse(null),
                                   profile,
                                   done);
        }
        catch (Exception e)
        {
            if (!outcome.setException(e))
            {
                LOGGER.warn("Verify function failed after completing for profile '{}'", profile.getId(), e);
            }
        }
        return outcome;
    }

    public GoogleTokenStrategyOptions getOptions()
    {
        return _options;
    }

    /**
     * The OAuth2 client used to talk to the provider, for applications that also drive the authorization code
     * flow.
     */
    public OAuth2Client getOAuth2Client()
    {
        return _oauth2Client;
    }

    @Override
    public void close()
    {
        if (_ownsExecutor)
        {
            _executor.shutdown();
        }
    }

    private static OAuth2Client createOAuth2Client(final GoogleTokenStrategyOptions options)
    {
        return new OAuth2Client(options.getClientId(),
                                options.getClientSecret(),
                                options.getAuthorizationURL(),
                                options.getTokenURL(),
                                options.getConnectTimeout(),
                                options.getReadTimeout(),
                                options.getTrustManagers());
    }

    private static <U> RequestVerifyFunction<U> adapt(final VerifyFunction<U> verifyFunction)
    {
        if (verifyFunction == null)
        {
            return null;
        }
        return (request, accessToken, refreshToken, profile, done) ->
                verifyFunction.verify(accessToken, refreshToken, profile, done);
    }
}
