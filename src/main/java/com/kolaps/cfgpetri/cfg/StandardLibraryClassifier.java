package com.kolaps.cfgpetri.cfg;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Классификатор по полным именам функций стандартной библиотеки Rust.
 * Функции, которых нет в таблице, считаются обычными, если у программы есть их граф,
 * и внешними в противном случае.
 */
public class StandardLibraryClassifier implements CalleeClassifier {

    private static final ImmutableSet<String> PANIC_FUNCTIONS = ImmutableSet.of(
            "std::rt::begin_panic",
            "std::rt::panic_fmt",
            "std::panicking::begin_panic",
            "core::panicking::panic",
            "core::panicking::panic_fmt",
            "core::panicking::panic_explicit",
            "core::panicking::unreachable_display");

    private static final ImmutableMap<String, CalleeKind> SYNCHRONIZATION_FUNCTIONS =
            ImmutableMap.<String, CalleeKind>builder()
                    .put("std::sync::Mutex::<T>::new", CalleeKind.MUTEX_NEW)
                    .put("std::sync::Mutex::<T>::lock", CalleeKind.MUTEX_LOCK)
                    .put("std::sync::Condvar::new", CalleeKind.CONDVAR_NEW)
                    .put("std::sync::Condvar::wait", CalleeKind.CONDVAR_WAIT)
                    .put("std::sync::Condvar::notify_one", CalleeKind.CONDVAR_NOTIFY_ONE)
                    .put("std::sync::Condvar::notify_all", CalleeKind.CONDVAR_NOTIFY_ALL)
                    .put("std::thread::spawn", CalleeKind.THREAD_SPAWN)
                    .put("std::thread::JoinHandle::<T>::join", CalleeKind.THREAD_JOIN)
                    .put("std::sync::Arc::<T>::new", CalleeKind.SHARED_NEW)
                    .put("std::clone::Clone::clone", CalleeKind.SHARED_CLONE)
                    .put("std::ops::Deref::deref", CalleeKind.SHARED_DEREF)
                    .build();

    private final ProgramSource program;

    public StandardLibraryClassifier(ProgramSource program) {
        this.program = checkNotNull(program);
    }

    @Override
    public CalleeKind classify(FunctionId callee) {
        String name = callee.getName();
        if (PANIC_FUNCTIONS.contains(name)) {
            return CalleeKind.PANIC;
        }
        CalleeKind kind = SYNCHRONIZATION_FUNCTIONS.get(name);
        if (kind != null) {
            return kind;
        }
        return program.hasCfg(callee) ? CalleeKind.ORDINARY : CalleeKind.FOREIGN;
    }
}
