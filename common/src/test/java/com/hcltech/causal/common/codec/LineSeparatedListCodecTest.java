package com.hcltech.causal.common.codec;

import com.hcltech.causal.common.errorsor.ErrorsOr;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LineSeparatedListCodecTest {

    /** Item codec that encodes ints as strings, but returns an error for negatives. */
    static class IntItemCodecWithErrors implements Codec<Integer, String> {
        @Override public ErrorsOr<String> encode(Integer from) {
            if (from < 0) return ErrorsOr.error("negatives not allowed: " + from);
            return ErrorsOr.lift(String.valueOf(from));
        }
        @Override public ErrorsOr<Integer> decode(String to) {
            try {
                int v = Integer.parseInt(to);
                if (v < 0) return ErrorsOr.error("negatives not allowed: " + v);
                return ErrorsOr.lift(v);
            } catch (NumberFormatException nfe) {
                return ErrorsOr.error("not a number: " + to);
            }
        }
    }

    private final Codec<List<Integer>, String> lines = Codec.lines(new IntItemCodecWithErrors());

    @Test
    void encode_aggregates_errors_from_item_codec() {
        var errs = lines.encode(List.of(-1, 1, -2)).errorsOrThrow();
        assertEquals(2, errs.size());
        assertTrue(errs.get(0).contains("negatives not allowed: -1"));
        assertTrue(errs.get(1).contains("negatives not allowed: -2"));
    }

    @Test
    void decode_reports_every_bad_line_with_its_number() {
        var errs = lines.decode("10\nfoo\n-5\n20").errorsOrThrow();
        assertEquals(List.of("line 2: not a number: foo", "line 3: negatives not allowed: -5"), errs);
    }

    @Test
    void decode_drops_single_trailing_newline() {
        assertEquals(List.of(1, 2), lines.decode("1\n2\n").valueOrThrow());
    }

    @Test
    void empty_input_and_empty_list_are_symmetric() {
        assertEquals(List.of(), lines.decode("").valueOrThrow());
        assertEquals("", lines.encode(List.of()).valueOrThrow());
    }
}
