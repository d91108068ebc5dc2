package com.acme.d;

import static com.google.common.truth.Truth.assertThat;

import java.util.List;

public class TwoRulesTest {

    void check() {
        List<String> items = List.of("a", "b");
        String s = "hello";
        assertThat(items).hasSize(2);
        assertThat(s).startsWith("he");
    }
}
