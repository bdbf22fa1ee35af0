package com.kolaps.cfgpetri.naming;

import static com.kolaps.cfgpetri.naming.NamingRegistry.sanitize;

/**
 * Метки мест и переходов, которые относятся к телу функции: базовые блоки,
 * операторы, терминаторы и вызовы функций без специальной семантики.
 * {@code function} здесь это метка активации из {@link NamingRegistry}.
 * <p>
 * Метка активации отделяется от остальной части двойным подчеркиванием: после
 * {@link NamingRegistry#sanitize(String)} в имени функции его быть не может, поэтому метки
 * {@code f} и {@code f_DROP} не пересекаются.
 */
public final class FunctionLabels {

    public static final String PROGRAM_START = "PROGRAM_START";
    public static final String PROGRAM_END = "PROGRAM_END";
    public static final String PROGRAM_PANIC = "PROGRAM_PANIC";

    private static final String SEPARATOR = "__";

    private FunctionLabels() {
        throw new AssertionError("Cannot instantiate static utility class");
    }

    public static String blockPlace(String function, int block) {
        return function + SEPARATOR + "BASIC_BLOCK_" + block;
    }

    /** Место после последнего оператора блока, из него выходит терминатор. */
    public static String blockEndPlace(String function, int block) {
        return function + SEPARATOR + "BASIC_BLOCK_END_PLACE_" + block;
    }

    public static String statementTransition(String function, int block, int statement) {
        return function + SEPARATOR + "BLOCK_" + block + "_STATEMENT_" + statement;
    }

    public static String statementEndPlace(String function, int block, int statement) {
        return statementTransition(function, block, statement) + "_END_PLACE";
    }

    public static String gotoTransition(String function, int block) {
        return function + SEPARATOR + "GOTO_" + block;
    }

    public static String switchTransition(String function, int block, int target) {
        return function + SEPARATOR + "SWITCH_INT_" + block + "_" + target;
    }

    public static String returnTransition(String function, int block) {
        return function + SEPARATOR + "RETURN_" + block;
    }

    public static String unwindTransition(String function, int block) {
        return function + SEPARATOR + "UNWIND_" + block;
    }

    public static String dropTransition(String function, int block) {
        return function + SEPARATOR + "DROP_" + block;
    }

    public static String dropUnwindTransition(String function, int block) {
        return function + SEPARATOR + "DROP_UNWIND_" + block;
    }

    public static String assertTransition(String function, int block) {
        return function + SEPARATOR + "ASSERT_" + block;
    }

    public static String assertCleanupTransition(String function, int block) {
        return function + SEPARATOR + "ASSERT_CLEANUP_" + block;
    }

    public static String foreignCallTransition(String function, int block, String callee) {
        return callSite(function, block) + sanitize(callee) + "_FOREIGN_CALL";
    }

    public static String divergingCallTransition(String function, int block, String callee) {
        return callSite(function, block) + sanitize(callee) + "_DIVERGING_CALL";
    }

    public static String panicTransition(String function, int block, String callee) {
        return callSite(function, block) + sanitize(callee) + "_PANIC";
    }

    public static String recursiveCallTransition(String function, int block, String callee) {
        return callSite(function, block) + sanitize(callee) + "_RECURSIVE_CALL";
    }

    /** Переход для раскрутки стека, парный к переходу вызова. */
    public static String unwindOf(String callTransitionLabel) {
        return callTransitionLabel + "_UNWIND";
    }

    private static String callSite(String function, int block) {
        return function + SEPARATOR + "BLOCK_" + block + "_";
    }
}
