package com.archiver.common.util;

import com.archiver.test.TestBase;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FileNamesTest extends TestBase {

    @Test
    void testPostFolderName() {
        assertEquals("[Alice] Week 3 (500)", FileNames.postFolderName("Alice", "Week 3", "500"));
    }

    @Test
    void testIllegalCharactersAreReplaced() {
        assertEquals("[A_B] what_ yes_no (1)", FileNames.postFolderName("A/B", "what? yes|no", "1"));
        assertEquals("a_b_c", FileNames.sanitize("a\tb\nc"));
    }

    @Test
    void testTrailingDotsAndBlankNames() {
        assertEquals("title", FileNames.sanitize("title..."));
        assertEquals("_", FileNames.sanitize(" .. "));
        assertEquals("_", FileNames.sanitize(""));
    }
}
