package com.acme.b;

import static com.google.common.truth.Truth.assertWithMessage;

public class MessageTest {

    void check() {
        boolean cond = 1 + 1 == 2;
        assertWithMessage("msg").that(cond).isTrue();
        assertWithMessage("value of %s", cond).that(cond).isTrue();
    }
}
