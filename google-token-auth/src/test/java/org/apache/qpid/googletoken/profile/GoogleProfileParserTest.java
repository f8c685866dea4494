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
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.junit.jupiter.api.Test;

import org.apache.qpid.googletoken.test.utils.UnitTestBase;

public class GoogleProfileParserTest extends UnitTestBase
{
    private final GoogleProfileParser _parser = new GoogleProfileParser();

    @Test
    public void testParseSparseProfile() throws Exception
    {
        final String body = "{\"sub\":\"42\",\"name\":\"Ada Lovelace\",\"email\":\"ada@example.com\"}";

        final GoogleProfile profile = _parser.parse(body);

        assertEquals("google", profile.getProvider(), "Unexpected provider");
        assertEquals("42", profile.getId(), "Unexpected id");
        assertEquals("Ada Lovelace", profile.getDisplayName(), "Unexpected display name");
        assertEquals(List.of(new ProfileValue("ada@example.com")), profile.getEmails(), "Unexpected emails");
        assertEquals("", profile.getName().getFamilyName(), "Unexpected family name");
        assertEquals("", profile.getName().getGivenName(), "Unexpected given name");
        assertEquals("", profile.getName().getMiddleName(), "Unexpected middle name");
        assertEquals("", profile.getGender(), "Unexpected gender");
        assertEquals(List.of(new ProfileValue("")), profile.getPhotos(), "Unexpected photos");
        assertEquals(body, profile.getRaw(), "Raw body should be kept untouched");
        assertEquals("ada@example.com", profile.getJson().get("email"), "Unexpected parsed json");
    }

    @Test
    public void testParseFullProfile() throws Exception
    {
        final String body = "{\"sub\":\"1234567890\",\"name\":\"Grace Brewster Hopper\","
                            + "\"family_name\":\"Hopper\",\"given_name\":\"Grace\",\"middle_name\":\"Brewster\","
                            + "\"gender\":\"female\",\"email\":\"grace@example.com\","
                            + "\"picture\":\"https://example.com/grace.png\",\"email_verified\":true}";

        final GoogleProfile profile = _parser.parse(body);

        assertEquals("1234567890", profile.getId(), "Unexpected id");
        assertEquals(new ProfileName("Hopper", "Grace", "Brewster"), profile.getName(), "Unexpected name");
        assertEquals("female", profile.getGender(), "Unexpected gender");
        assertEquals(List.of(new ProfileValue("grace@example.com")), profile.getEmails(), "Unexpected emails");
        assertEquals(List.of(new ProfileValue("https://example.com/grace.png")), profile.getPhotos(), "Unexpected photos");
        assertEquals(Boolean.TRUE, profile.getJson().get("email_verified"), "Unknown claims should be kept");
    }

    @Test
    public void testParseEmptyObject() throws Exception
    {
        final GoogleProfile profile = _parser.parse("{}");

        assertEquals("", profile.getId(), "Unexpected id");
        assertEquals("", profile.getDisplayName(), "Unexpected display name");
        assertEquals(1, profile.getEmails().size(), "Exactly one email entry expected");
        assertEquals("", profile.getEmails().get(0).getValue(), "Unexpected email");
        assertEquals(1, profile.getPhotos().size(), "Exactly one photo entry expected");
    }

    @Test
    public void testParseNullClaimsAsEmpty() throws Exception
    {
        final GoogleProfile profile = _parser.parse("{\"sub\":\"7\",\"name\":null,\"picture\":null}");

        assertEquals("7", profile.getId(), "Unexpected id");
        assertEquals("", profile.getDisplayName(), "Unexpected display name");
        assertEquals("", profile.getPhotos().get(0).getValue(), "Unexpected photo");
    }

    @Test
    public void testParseNonJson()
    {
        assertThrows(JsonProcessingException.class, () -> _parser.parse("<html>Service Unavailable</html>"),
                     "Exception not thrown");
    }

    @Test
    public void testParseJsonFollowedByMarkup()
    {
        assertThrows(JsonProcessingException.class, () -> _parser.parse("{\"sub\":\"42\"} <html>oops</html>"),
                     "Exception not thrown");
    }

    @Test
    public void testParseConcatenatedJsonObjects()
    {
        assertThrows(JsonProcessingException.class, () -> _parser.parse("{\"sub\":\"42\"}{\"sub\":\"43\"}"),
                     "Exception not thrown");
    }

    @Test
    public void testParseNonStringClaimsAsEmpty() throws Exception
    {
        final GoogleProfile profile = _parser.parse("{\"sub\":42,\"name\":false,\"gender\":{\"a\":1},"
                                                    + "\"email\":[\"ada@example.com\"]}");

        assertEquals("42", profile.getId(), "Numeric id should be kept");
        assertEquals("", profile.getDisplayName(), "Unexpected display name");
        assertEquals("", profile.getGender(), "Unexpected gender");
        assertEquals("", profile.getEmails().get(0).getValue(), "Unexpected email");
    }

    @Test
    public void testParseJsonThatIsNotAnObject()
    {
        assertThrows(JsonProcessingException.class, () -> _parser.parse("[\"sub\"]"), "Exception not thrown");
        assertThrows(JsonProcessingException.class, () -> _parser.parse("null"), "Exception not thrown");
    }

    @Test
    public void testProfileIsImmutable() throws Exception
    {
        final GoogleProfile profile = _parser.parse("{\"sub\":\"42\"}");

        assertThrows(UnsupportedOperationException.class, () -> profile.getEmails().add(new ProfileValue("x")));
        assertThrows(UnsupportedOperationException.class, () -> profile.getJson().put("sub", "43"));
    }
}
