package ru.oparin.tutor.util;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JwtUtilTest {

    @Test
    void bearerPrefixShouldBeMatchedCaseInsensitively() {
        assertEquals(Optional.of("abc.def.ghi"), JwtUtil.extractToken("Bearer abc.def.ghi"));
        assertEquals(Optional.of("abc.def.ghi"), JwtUtil.extractToken("bearer   abc.def.ghi "));
    }

    @Test
    void missingOrForeignSchemeShouldGiveEmpty() {
        assertEquals(Optional.empty(), JwtUtil.extractToken((String) null));
        assertEquals(Optional.empty(), JwtUtil.extractToken("Basic dXNlcjpwYXNz"));
        assertEquals(Optional.empty(), JwtUtil.extractToken("Bearer"));
    }

    @Test
    void emptyTokenAfterPrefixShouldBePresentButEmpty() {
        assertEquals(Optional.of(""), JwtUtil.extractToken("Bearer "));
    }
}
