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
import java.net.HttpURLConnection;
import java.net.URI;
import java.net.URLEncoder;
import java.util.Iterator;
import java.util.Map;

public final class OAuth2Utils
{
    private OAuth2Utils()
    {
    }

    public static String buildRequestQuery(final Map<String, String> requestParameters)
    {
        final StringBuilder queryBuilder = new StringBuilder();
        final Iterator<Map.Entry<String, String>> iterator = requestParameters.entrySet().iterator();
        while (iterator.hasNext())
        {
            final Map.Entry<String, String> entry = iterator.next();
            queryBuilder.append(URLEncoder.encode(entry.getKey(), UTF_8));
            queryBuilder.append("=");
            queryBuilder.append(URLEncoder.encode(entry.getValue(), UTF_8));
            if (iterator.hasNext())
            {
                queryBuilder.append("&");
            }
        }
        return queryBuilder.toString();
    }

    /**
     * Appends the given parameters to the query of {@code uri}, keeping any query it already carries.
     */
    public static URI appendQuery(final URI uri, final Map<String, String> parameters)
    {
        if (parameters.isEmpty())
        {
            return uri;
        }
        final String uriString = uri.toString();
        final int fragmentStart = uriString.indexOf('#');
        final String base = fragmentStart < 0 ? uriString : uriString.substring(0, fragmentStart);
        final String fragment = fragmentStart < 0 ? "" : uriString.substring(fragmentStart);
        final String separator = uri.getRawQuery() == null ? "?" : (base.endsWith("?") || base.endsWith("&") ? "" : "&");
        return URI.create(base + separator + buildRequestQuery(parameters) + fragment);
    }

    public static InputStream getResponseStream(final HttpURLConnection connection) throws IOException
    {
        try
        {
            return connection.getInputStream();
        }
        catch (IOException ioe)
        {
            final InputStream errorStream = connection.getErrorStream();
            if (errorStream != null)
            {
                return errorStream;
            }
            throw ioe;
        }
    }

    static boolean isSuccessful(final int responseCode)
    {
        return responseCode >= 200 && responseCode < 300;
    }
}
