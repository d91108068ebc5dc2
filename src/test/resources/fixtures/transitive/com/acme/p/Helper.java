package com.acme.p;

import static com.google.common.truth.Truth.assertThat;

public class Helper {

    public static String name() {
        return "p";
    }

    static void selfCheck() {
        assertThat(name()).isNotNull();
    }
}
