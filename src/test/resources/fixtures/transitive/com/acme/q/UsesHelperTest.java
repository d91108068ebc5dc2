package com.acme.q;

import com.acme.p.Helper;
import com.google.common.truth.Truth;

public class UsesHelperTest {

    void check() {
        Truth.assertThat(Helper.name()).isEqualTo("p");
    }
}
