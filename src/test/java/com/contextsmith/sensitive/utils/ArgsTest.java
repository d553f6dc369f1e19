package com.contextsmith.sensitive.utils;

import static com.contextsmith.sensitive.utils.Args.options;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

public class ArgsTest {
    String val = null;

    @Test
    public void match() throws Exception {
        final boolean[] gotOption = new boolean[1];
        Args.match().on("--interactive", () -> gotOption[0] = true).parse("--interactive");
        assertTrue(gotOption[0]);
    }

    @Test
    public void consume() throws Exception {
        Args.match().on("--words", value -> val = value).parse("--words", "list.json");
        assertEquals("list.json", val);
    }

    @Test
    public void trailingOptionGetsNull() throws Exception {
        val = "unset";
        Args.match().on("--words", value -> val = value).parse("--words");
        assertNull(val);
    }

    @Test
    public void rest() throws Exception {
        List<String> rest = new ArrayList<>();
        Args.match().on("--max", value -> val = value).rest(rest::addAll)
                .parse("--max", "5", "r1", "r2");
        assertEquals("5", val);
        assertEquals(Arrays.asList("r1", "r2"), rest);
    }

    @Test
    public void alternatives() throws Exception {
        List<String> values = new ArrayList<>();
        Args.match().on(options("--text", "-t"), values::add).parse("--text", "a", "-T", "b");
        assertEquals(Arrays.asList("a", "b"), values);
    }
}
