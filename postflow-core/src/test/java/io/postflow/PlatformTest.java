package io.postflow;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PlatformTest {

    @Test
    void resolvesTagsIgnoringCase() {
        assertEquals(Platform.TWITTER, Platform.fromTag("twitter"));
        assertEquals(Platform.LINKEDIN, Platform.fromTag(" LinkedIn "));
        assertEquals("instagram", Platform.INSTAGRAM.tag());
    }

    @Test
    void rejectsUnknownTag() {
        assertThrows(IllegalArgumentException.class, () -> Platform.fromTag("myspace"));
        assertThrows(IllegalArgumentException.class, () -> Platform.fromTag(null));
    }
}
