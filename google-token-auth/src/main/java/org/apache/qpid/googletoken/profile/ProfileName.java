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

import java.util.Objects;

public final class ProfileName
{
    private final String _familyName;
    private final String _givenName;
    private final String _middleName;

    public ProfileName(final String familyName, final String givenName, final String middleName)
    {
        _familyName = Objects.requireNonNull(familyName, "familyName cannot be null");
        _givenName = Objects.requireNonNull(givenName, "givenName cannot be null");
        _middleName = Objects.requireNonNull(middleName, "middleName cannot be null");
    }

    public String getFamilyName()
    {
        return _familyName;
    }

    public String getGivenName()
    {
        return _givenName;
    }

    public String getMiddleName()
    {
        return _middleName;
    }

    @Override
    public boolean equals(final Object o)
    {
        if (this == o)
        {
            return true;
        }
        if (o == null || getClass() != o.getClass())
        {
            return false;
        }
        final ProfileName that = (ProfileName) o;
        return _familyName.equals(that._familyName)
               && _givenName.equals(that._givenName)
               && _middleName.equals(that._middleName);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(_familyName, _givenName, _middleName);
    }

    @Override
    public String toString()
    {
        return "ProfileName{" +
               "familyName='" + _familyName + '\'' +
               ", givenName='" + _givenName + '\'' +
               ", middleName='" + _middleName + '\'' +
               '}';
    }
}
