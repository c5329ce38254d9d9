package com.mylist.domain.model;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ContentTypeTest {

    @Test
    void shouldResolveWireNames() {
        assertEquals(Optional.of(ContentType.MOVIE), ContentType.fromWireName("movie"));
        assertEquals(Optional.of(ContentType.TV_SHOW), ContentType.fromWireName("tvshow"));
    }

    @Test
    void shouldRejectUnknownOrMissingNames() {
        assertTrue(ContentType.fromWireName("podcast").isEmpty());
        assertTrue(ContentType.fromWireName(null).isEmpty());
    }
}
