package com.acme.a;

import static com.google.common.truth.Truth.assertThat;

public class EqualityTest {

    void equal() {
        String got = compute();
        String want = "x";
        assertThat(got).isEqualTo(want);
    }

    void assignable() {
        Class<?> a = Integer.class;
        Class<?> b = Number.class;
        assertThat(a).isAssignableTo(b);
    }

    private String compute() {
        return "x";
    }
}
