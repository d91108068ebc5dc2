package com.acme.e;

import static com.google.common.truth.Truth.assertThat;

public class PartialTest {

    void check() {
        String s = "";
        assertThat(s).isEmpty();
        assertThat(s).isNotNull();
    }
}
