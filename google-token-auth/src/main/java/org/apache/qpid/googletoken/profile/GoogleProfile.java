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

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * User profile in normalised form.
 * <p>
 * The shape is fixed whatever claims the provider returned: every string property is non-null (empty when the
 * claim was missing) and {@link #getEmails()} and {@link #getPhotos()} always hold exactly one entry.
 * The untouched response is kept in {@link #getRaw()} and its parsed form in {@link #getJson()}.
 */
public final class GoogleProfile
{
    public static final String PROVIDER = "google";

    private final String _id;
    private final String _displayName;
    private final ProfileName _name;
    private final String _gender;
    private final List<ProfileValue> _emails;
    private final List<ProfileValue> _photos;
    private final String _raw;
    private final Map<String, Object> _json;

    GoogleProfile(final String id,
                  final String displayName,
                  final ProfileName name,
                  final String gender,
                  final ProfileValue email,
                  final ProfileValue photo,
                  final String raw,
                  final Map<String, Object> json)
    {
        _id = Objects.requireNonNull(id);
        _displayName = Objects.requireNonNull(displayName);
        _name = Objects.requireNonNull(name);
        _gender = Objects.requireNonNull(gender);
        _emails = Collections.singletonList(Objects.requireNonNull(email));
        _photos = Collections.singletonList(Objects.requireNonNull(photo));
        _raw = Objects.requireNonNull(raw);
        _json = Collections.unmodifiableMap(json);
    }

    public String getProvider()
    {
        return PROVIDER;
    }

    public String getId()
    {
        return _id;
    }

    public String getDisplayName()
    {
        return _displayName;
    }

    public ProfileName getName()
    {
        return _name;
    }

    public String getGender()
    {
        return _gender;
    }

    public List<ProfileValue> getEmails()
    {
        return _emails;
    }

    public List<ProfileValue> getPhotos()
    {
        return _photos;
    }

    public String getRaw()
    {
        return _raw;
    }

    public Map<String, Object> getJson()
    {
        return _json;
    }

    @Override
    public String toString()
    {
        return "GoogleProfile{" +
               "provider='" + PROVIDER + '\'' +
               ", id='" + _id + '\'' +
               ", displayName='" + _displayName + '\'' +
               '}';
    }
}
