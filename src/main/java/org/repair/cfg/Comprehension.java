package org.repair.cfg;

import java.util.Set;

/**
 * return 表达式中的列表推导式或生成器表达式（只取第一个 for 子句）。
 *
 * @param generator      true 表示生成器表达式，false 表示列表推导式
 * @param element        元素表达式
 * @param target         循环变量
 * @param iterable       被迭代的表达式
 * @param filter         第一个 if 过滤条件，可为 null
 * @param returnText     用临时变量替换推导式后的完整 return 语句
 * @param elementCalls   元素表达式中的调用名
 * @param iterableCalls  迭代表达式中的调用名
 * @param filterCalls    过滤条件中的调用名
 */
public record Comprehension(boolean generator,
                            String element,
                            String target,
                            String iterable,
                            String filter,
                            String returnText,
                            Set<String> elementCalls,
                            Set<String> iterableCalls,
                            Set<String> filterCalls) {

    /** 列表推导式结果的临时变量名 */
    public static final String LIST_RESULT = "result";
    /** 生成器表达式结果的临时变量名 */
    public static final String GENERATOR_RESULT = "temp_list";
    /** 生成器每次迭代元素的临时变量名 */
    public static final String GENERATOR_ITEM = "temp_result";

    public String loopCondition() {
        return target + " in " + iterable;
    }
}
