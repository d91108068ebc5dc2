package com.initialone.jmigrate.catalog;

import com.initialone.jmigrate.model.ApiEntry;
import com.initialone.jmigrate.model.ImportStyle;
import com.initialone.jmigrate.model.RewriteFamily;
import com.initialone.jmigrate.model.Step;

import java.util.List;
import java.util.Map;
import java.util.Set;

/** 内置的两个改写家族：Strict（断言失败即终止）和 Soft（假设不成立则跳过，继续其余测试）。 */
public final class Families {
    public static final String TRUTH = "com.google.common.truth.Truth";
    public static final String TRUTH_JUNIT = "com.google.common.truth.TruthJUnit";
    public static final String ASSERTJ_ASSERTIONS = "org.assertj.core.api.Assertions";
    public static final String ASSERTJ_ASSUMPTIONS = "org.assertj.core.api.Assumptions";
    public static final String ASSERTJ_OFFSET = "org.assertj.core.data.Offset";

    private Families() {
    }

    public static RewriteFamily strict() {
        ApiEntry source = new ApiEntry(TRUTH,
                List.of(Step.of("assertThat", Step.SUBJECT)),
                List.of(Step.of("assertWithMessage", Step.MESSAGE), Step.of("that", Step.SUBJECT)),
                Set.of("assertThat", "assertWithMessage", "assert_", "assertAbout"));
        ApiEntry destination = new ApiEntry(ASSERTJ_ASSERTIONS,
                List.of(Step.of("assertThat", Step.SUBJECT)),
                List.of(Step.of("assertThat", Step.SUBJECT), Step.of("as", Step.MESSAGE)),
                Set.of("assertThat"));
        return new RewriteFamily("strict", source, destination,
                Map.of("Offset", ASSERTJ_OFFSET), ImportStyle.STATIC_MEMBER);
    }

    public static RewriteFamily soft() {
        ApiEntry source = new ApiEntry(TRUTH_JUNIT,
                List.of(Step.of("assume"), Step.of("that", Step.SUBJECT)),
                List.of(Step.of("assume"), Step.of("withMessage", Step.MESSAGE), Step.of("that", Step.SUBJECT)),
                Set.of("assume"));
        ApiEntry destination = new ApiEntry(ASSERTJ_ASSUMPTIONS,
                List.of(Step.of("assumeThat", Step.SUBJECT)),
                List.of(Step.of("assumeThat", Step.SUBJECT), Step.of("as", Step.MESSAGE)),
                Set.of("assumeThat"));
        return new RewriteFamily("soft", source, destination,
                Map.of("Offset", ASSERTJ_OFFSET), ImportStyle.STATIC_MEMBER);
    }

    public static List<RewriteFamily> builtin() {
        return List.of(strict(), soft());
    }
}
