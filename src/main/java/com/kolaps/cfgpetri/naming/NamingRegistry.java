package com.kolaps.cfgpetri.naming;

import com.google.common.base.CharMatcher;
import com.kolaps.cfgpetri.cfg.FunctionId;

import java.util.HashSet;
import java.util.Set;

/**
 * Реестр имен функций.
 * <p>
 * Каждая активация функции получает собственную метку, которая служит префиксом для
 * всех мест и переходов ее тела: первая активация {@code main} называется {@code main},
 * вторая {@code main_1} и т.д. Остальные метки строятся чистыми функциями из
 * {@link FunctionLabels} и {@link SyncLabels}, поэтому повторный запрос той же
 * сущности дает ту же строку.
 */
public class NamingRegistry {

    private static final CharMatcher LABEL_CHARS = CharMatcher.inRange('a', 'z')
            .or(CharMatcher.inRange('A', 'Z'))
            .or(CharMatcher.inRange('0', '9'))
            .precomputed();

    private final Set<String> issuedFunctionLabels = new HashSet<>();

    /**
     * Выдает новую уникальную метку для очередной активации функции.
     */
    public String allocateFunctionLabel(FunctionId function) {
        String base = sanitize(function.getName());
        String candidate = base;
        int suffix = 1;
        while (issuedFunctionLabels.contains(candidate)) {
            candidate = base + "_" + suffix++;
        }
        issuedFunctionLabels.add(candidate);
        return candidate;
    }

    /**
     * Превращает полное имя ({@code std::sync::Mutex::<T>::new}) в токен, пригодный
     * для метки ({@code std_sync_Mutex_T_new}).
     */
    public static String sanitize(String rawName) {
        String collapsed = LABEL_CHARS.negate().collapseFrom(rawName, '_');
        String trimmed = CharMatcher.is('_').trimFrom(collapsed);
        return trimmed.isEmpty() ? "anonymous" : trimmed;
    }
}
