package com.initialone.jmigrate.ast;

import com.github.javaparser.ast.DataKey;

/** 引擎与 reconciler 之间共享的节点标记。 */
public final class Markers {
    /** 引擎插入的全限定 owner 引用（如 org.assertj.core.api.Assertions），值是 FQN。 */
    public static final DataKey<String> INSERTED_OWNER = new DataKey<String>() {
    };

    private Markers() {
    }
}
