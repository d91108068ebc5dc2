package com.initialone.jmigrate.engine;

import com.initialone.jmigrate.exceptions.MatchApplicationException;

/** 由一个模板单元派生的匹配/改写器。 */
public interface Matcher {
    /** 名字，诊断输出用（通常是模板单元名）。 */
    String name();

    /**
     * 对文件里每个表达式尝试匹配 before 形状，命中则原地替换为 after 形状。
     *
     * @return 本文件的替换次数
     */
    int apply(TargetFile file) throws MatchApplicationException;
}
