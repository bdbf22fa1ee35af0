package com.kolaps.cfgpetri;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.kolaps.cfgpetri.cfg.BasicBlock;
import com.kolaps.cfgpetri.cfg.CalleeClassifier;
import com.kolaps.cfgpetri.cfg.CalleeKind;
import com.kolaps.cfgpetri.cfg.Capture;
import com.kolaps.cfgpetri.cfg.FunctionId;
import com.kolaps.cfgpetri.cfg.Location;
import com.kolaps.cfgpetri.cfg.Operand;
import com.kolaps.cfgpetri.cfg.ProgramSource;
import com.kolaps.cfgpetri.cfg.Rvalue;
import com.kolaps.cfgpetri.cfg.StandardLibraryClassifier;
import com.kolaps.cfgpetri.cfg.Statement;
import com.kolaps.cfgpetri.cfg.Terminator;
import com.kolaps.cfgpetri.memory.CondvarRef;
import com.kolaps.cfgpetri.memory.HandleMemory;
import com.kolaps.cfgpetri.memory.MutexRef;
import com.kolaps.cfgpetri.model.CallPlaces;
import com.kolaps.cfgpetri.model.ThreadSpan;
import com.kolaps.cfgpetri.naming.NamingRegistry;
import com.kolaps.cfgpetri.net.PetriNet;
import com.kolaps.cfgpetri.net.Place;
import com.kolaps.cfgpetri.net.Transition;
import com.kolaps.cfgpetri.sync.CondvarManager;
import com.kolaps.cfgpetri.sync.MutexManager;
import com.kolaps.cfgpetri.sync.PrimitiveCall;
import com.kolaps.cfgpetri.sync.SharedHandleManager;
import com.kolaps.cfgpetri.sync.ThreadManager;
import com.kolaps.cfgpetri.utils.CallStack;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;
import static com.google.common.base.Verify.verify;
import static com.kolaps.cfgpetri.naming.FunctionLabels.*;

/**
 * Транслятор программы в сеть Петри.
 * <p>
 * Обход идет по явному стеку вызовов: верхний кадр транслирует свои блоки по порядку номеров,
 * вызов функции с доступным графом кладет на стек новый кадр, {@code Return} последнего блока
 * снимает кадр. Тела потоков транслируются после того, как стек опустел, в порядке их запуска:
 * к этому моменту известны все переходы {@code join}.
 * <p>
 * Экземпляр рассчитан на один запуск {@link #run()}.
 */
public class Translator {

    private static final Logger log = LoggerFactory.getLogger(Translator.class);

    private final ProgramSource program;
    private final CalleeClassifier classifier;
    private final boolean skipRecursiveCalls;

    private final PetriNet net = new PetriNet();
    private final NamingRegistry naming = new NamingRegistry();
    private final CallStack<ActivationRecord> callStack = new CallStack<>();

    private final MutexManager mutexManager;
    private final CondvarManager condvarManager;
    private final ThreadManager threadManager;
    private final SharedHandleManager sharedHandleManager;

    private final Place programStart;
    private final Place programEnd;
    private final Place programPanic;

    private boolean finished;
    private String error;

    public Translator(ProgramSource program) {
        this(program, new StandardLibraryClassifier(program));
    }

    public Translator(ProgramSource program, CalleeClassifier classifier) {
        this.program = checkNotNull(program);
        this.classifier = checkNotNull(classifier);
        this.skipRecursiveCalls = Options.INSTANCE.getBooleanOption("translator.skip_recursive_calls", false);

        this.mutexManager = new MutexManager(net);
        this.condvarManager = new CondvarManager(net, mutexManager);
        this.threadManager = new ThreadManager(net);
        this.sharedHandleManager = new SharedHandleManager(net);

        this.programStart = net.addPlace(PROGRAM_START);
        this.programEnd = net.addPlace(PROGRAM_END);
        this.programPanic = net.addPlace(PROGRAM_PANIC);
        net.addToken(programStart, 1);
    }

    /**
     * Транслирует программу, начиная с входной функции. Если входной функции нет,
     * сеть не строится, а {@link #getResult()} сообщит об ошибке.
     */
    public void run() {
        checkState(!finished, "Трансляция уже выполнена");
        finished = true;

        Optional<FunctionId> entryPoint = program.entryPoint();
        if (!entryPoint.isPresent()) {
            error = "Входная функция программы не найдена";
            log.error(error);
            return;
        }
        log.info("Трансляция начинается с функции {}", entryPoint.get());

        pushFunction(entryPoint.get(), new CallPlaces(programStart, programEnd), null, ImmutableList.of(), null);
        translateCallStack();
        translateThreads();

        log.info("Сеть построена: {} мест, {} переходов, {} дуг",
                net.placeCount(), net.transitionCount(), net.arcCount());
    }

    /**
     * @return построенная сеть
     * @throws TranslationException если у программы нет входной функции
     * @throws IllegalStateException если {@link #run()} еще не вызывался
     */
    public PetriNet getResult() throws TranslationException {
        checkState(finished, "Сначала нужно вызвать run()");
        if (error != null) {
            throw new TranslationException(error);
        }
        return net;
    }

    /** Сеть в текущем состоянии, в том числе до {@link #run()}. */
    @VisibleForTesting
    PetriNet currentNet() {
        return net;
    }

    private ActivationRecord pushFunction(FunctionId function, CallPlaces places, Location returnDestination,
                                          List<Operand> args, HandleMemory callerMemory) {
        verify(program.hasCfg(function), "BUG: нет графа для функции %s", function);
        ActivationRecord record = new ActivationRecord(function, naming.allocateFunctionLabel(function),
                program.cfgOf(function), places, returnDestination);

        for (int i = 0; i < args.size(); i++) {
            Optional<Location> argument = args.get(i).getLocation();
            if (argument.isPresent() && callerMemory != null) {
                callerMemory.transfer(argument.get(), record.getMemory(), Location.argument(i));
            }
        }
        callStack.push(record);
        log.debug("Вход в функцию {} ({}), глубина стека {}", function, record.getLabel(), callStack.size());
        return record;
    }

    private void popFunction() {
        ActivationRecord record = callStack.pop();
        Optional<Location> destination = record.getReturnDestination();
        if (destination.isPresent() && !callStack.isEmpty()) {
            record.getMemory().copyRootedAt(Location.RETURN_VALUE, callStack.peek().getMemory(), destination.get());
        }
        log.debug("Выход из функции {}", record.getLabel());
    }

    private void translateCallStack() {
        while (!callStack.isEmpty()) {
            ActivationRecord top = callStack.peek();
            if (top.hasMoreBlocks()) {
                translateBlock(top, top.nextBlock());
            } else {
                popFunction();
            }
        }
    }

    private void translateThreads() {
        while (threadManager.hasPendingThreads()) {
            ThreadSpan thread = threadManager.nextPendingThread();
            log.info("Трансляция потока {}", thread);
            CallPlaces places = thread.prepareForTranslation(net);
            ActivationRecord record = pushFunction(thread.getThreadFunction(), places, null, ImmutableList.of(), null);
            moveCapturedHandles(thread, record);
            translateCallStack();
        }
    }

    /**
     * Связывает перемещенные в поток дескрипторы с местами, объявленными в функции потока.
     * Соответствие устанавливается по порядку обнаружения отдельно для каждого вида.
     */
    private void moveCapturedHandles(ThreadSpan thread, ActivationRecord record) {
        Iterator<MutexRef> mutexes = thread.getMutexes().iterator();
        Iterator<CondvarRef> condvars = thread.getCondvars().iterator();
        HandleMemory memory = record.getMemory();

        for (Capture capture : record.getCfg().getCaptures()) {
            switch (capture.getType()) {
                case MUTEX:
                    verify(mutexes.hasNext(), "BUG: функция потока %s получает больше мьютексов, чем было обнаружено",
                            thread.getThreadFunction());
                    memory.mutexes().link(capture.getLocation(), mutexes.next());
                    break;
                case CONDVAR:
                    verify(condvars.hasNext(),
                            "BUG: функция потока %s получает больше условных переменных, чем было обнаружено",
                            thread.getThreadFunction());
                    memory.condvars().link(capture.getLocation(), condvars.next());
                    break;
                default:
                    throw new IllegalStateException("Неизвестный вид захвата: " + capture.getType());
            }
        }
        if (mutexes.hasNext() || condvars.hasNext()) {
            log.warn("{}: часть перемещенных в поток дескрипторов не объявлена в функции {} и будет потеряна",
                    thread, thread.getThreadFunction());
        }
    }

    private void translateBlock(ActivationRecord record, BasicBlock block) {
        String function = record.getLabel();
        int index = block.getIndex();
        Place current = record.getBlockPlace(index, net);

        List<Statement> statements = block.getStatements();
        for (int i = 0; i < statements.size(); i++) {
            Transition transition = net.addTransition(statementTransition(function, index, i));
            net.addArc(current, transition);
            Place next = i == statements.size() - 1
                    ? net.addPlace(blockEndPlace(function, index))
                    : net.addPlace(statementEndPlace(function, index, i));
            net.addArc(transition, next);
            applyStatement(record.getMemory(), statements.get(i));
            current = next;
        }
        translateTerminator(record, index, block.getTerminator(), current);
    }

    /**
     * Присваивания, которые копируют, перемещают, берут ссылку или собирают агрегат,
     * переносят дескрипторы на место назначения.
     */
    private void applyStatement(HandleMemory memory, Statement statement) {
        if (!(statement instanceof Statement.Assign)) {
            return;
        }
        Statement.Assign assign = (Statement.Assign) statement;
        Location target = assign.getTarget();
        Rvalue value = assign.getValue();

        if (value instanceof Rvalue.Use) {
            Optional<Location> source = ((Rvalue.Use) value).getOperand().getLocation();
            if (source.isPresent()) {
                memory.propagate(target, source.get());
            }
        } else if (value instanceof Rvalue.Ref) {
            memory.propagate(target, ((Rvalue.Ref) value).getLocation());
        } else if (value instanceof Rvalue.Aggregate) {
            List<Operand> fields = ((Rvalue.Aggregate) value).getFields();
            for (int j = 0; j < fields.size(); j++) {
                Optional<Location> source = fields.get(j).getLocation();
                if (source.isPresent()) {
                    memory.propagate(target.field(j), source.get());
                }
            }
        }
    }

    private void translateTerminator(ActivationRecord record, int block, Terminator terminator, Place start) {
        String function = record.getLabel();

        if (terminator instanceof Terminator.Goto) {
            int target = ((Terminator.Goto) terminator).getTarget();
            connect(start, gotoTransition(function, block), record.getBlockPlace(target, net));
        } else if (terminator instanceof Terminator.SwitchInt) {
            for (int target : ((Terminator.SwitchInt) terminator).getTargets()) {
                connect(start, switchTransition(function, block, target), record.getBlockPlace(target, net));
            }
        } else if (terminator instanceof Terminator.Return) {
            connect(start, returnTransition(function, block), record.getEndPlace());
        } else if (terminator instanceof Terminator.Resume) {
            connect(start, unwindTransition(function, block), record.getCleanupPlace().orElse(programPanic));
        } else if (terminator instanceof Terminator.Unreachable) {
            log.debug("{}: блок bb{} недостижим", function, block);
        } else if (terminator instanceof Terminator.Drop) {
            translateDrop(record, block, (Terminator.Drop) terminator, start);
        } else if (terminator instanceof Terminator.Assert) {
            Terminator.Assert assertion = (Terminator.Assert) terminator;
            connect(start, assertTransition(function, block), record.getBlockPlace(assertion.getTarget(), net));
            OptionalInt cleanup = assertion.getCleanup();
            if (cleanup.isPresent()) {
                connect(start, assertCleanupTransition(function, block),
                        record.getBlockPlace(cleanup.getAsInt(), net));
            }
        } else if (terminator instanceof Terminator.Call) {
            FunctionCall call = prepareFunctionCall(record, (Terminator.Call) terminator, start);
            callFunction(record, block, call);
        } else {
            throw new IllegalStateException("Неподдерживаемый терминатор: " + terminator);
        }
    }

    private void translateDrop(ActivationRecord record, int block, Terminator.Drop drop, Place start) {
        String function = record.getLabel();
        Transition transition = connect(start, dropTransition(function, block),
                record.getBlockPlace(drop.getTarget(), net));
        if (record.getMemory().lockGuards().contains(drop.getLocation())) {
            mutexManager.translateUnlock(drop.getLocation(), transition, record.getMemory());
        }
        OptionalInt cleanup = drop.getCleanup();
        if (cleanup.isPresent()) {
            connect(start, dropUnwindTransition(function, block), record.getBlockPlace(cleanup.getAsInt(), net));
        }
    }

    private Transition connect(Place source, String label, Place target) {
        Transition transition = net.addTransition(label);
        net.addArc(source, transition);
        net.addArc(transition, target);
        return transition;
    }

    private FunctionCall prepareFunctionCall(ActivationRecord record, Terminator.Call call, Place start) {
        FunctionId callee = call.getCallee();
        CalleeKind calleeKind = classifier.classify(callee);

        if (calleeKind == CalleeKind.PANIC) {
            return FunctionCall.withoutReturn(FunctionCall.Kind.PANIC, calleeKind, call, start);
        }
        OptionalInt target = call.getTarget();
        if (!target.isPresent()) {
            return FunctionCall.withoutReturn(FunctionCall.Kind.DIVERGING, calleeKind, call, start);
        }

        Place end = record.getBlockPlace(target.getAsInt(), net);
        OptionalInt cleanup = call.getCleanup();
        Place cleanupPlace = cleanup.isPresent() ? record.getBlockPlace(cleanup.getAsInt(), net) : null;
        CallPlaces places = new CallPlaces(start, end, cleanupPlace);

        if (calleeKind == CalleeKind.FOREIGN) {
            return FunctionCall.returning(FunctionCall.Kind.FOREIGN, calleeKind, call, places);
        }
        if (calleeKind.isSynchronization()) {
            return FunctionCall.returning(FunctionCall.Kind.SYNCHRONIZATION, calleeKind, call, places);
        }
        if (skipRecursiveCalls && callStack.contains(frame -> frame.getFunction().equals(callee))) {
            return FunctionCall.returning(FunctionCall.Kind.RECURSIVE, calleeKind, call, places);
        }
        return FunctionCall.returning(FunctionCall.Kind.ORDINARY, calleeKind, call, places);
    }

    private void callFunction(ActivationRecord record, int block, FunctionCall call) {
        String function = record.getLabel();
        Terminator.Call terminator = call.getTerminator();
        String callee = terminator.getCallee().getName();

        switch (call.getKind()) {
            case PANIC:
                SpecialFunctions.panic(net, call.getStart(), programPanic, panicTransition(function, block, callee));
                break;
            case DIVERGING:
                SpecialFunctions.divergingCall(net, call.getStart(), divergingCallTransition(function, block, callee));
                break;
            case FOREIGN:
                SpecialFunctions.foreignCall(net, call.getPlaces().get(), foreignCallTransition(function, block, callee));
                break;
            case RECURSIVE:
                log.warn("Рекурсивный вызов {} из {} транслируется как внешний", callee, function);
                SpecialFunctions.foreignCall(net, call.getPlaces().get(),
                        recursiveCallTransition(function, block, callee));
                break;
            case SYNCHRONIZATION:
                callSynchronizationPrimitive(record, call);
                break;
            case ORDINARY:
                pushFunction(terminator.getCallee(), call.getPlaces().get(), terminator.getDestination(),
                        terminator.getArgs(), record.getMemory());
                break;
            default:
                throw new IllegalStateException("Неизвестный вид вызова: " + call.getKind());
        }
    }

    private void callSynchronizationPrimitive(ActivationRecord record, FunctionCall call) {
        Terminator.Call terminator = call.getTerminator();
        PrimitiveCall primitiveCall = new PrimitiveCall(terminator.getCallee(), terminator.getArgs(),
                terminator.getDestination(), call.getPlaces().get());
        HandleMemory memory = record.getMemory();

        switch (call.getCalleeKind()) {
            case MUTEX_NEW:
                mutexManager.translateCallNew(primitiveCall, memory);
                break;
            case MUTEX_LOCK:
                mutexManager.translateCallLock(primitiveCall, memory);
                break;
            case CONDVAR_NEW:
                condvarManager.translateCallNew(primitiveCall, memory);
                break;
            case CONDVAR_WAIT:
                condvarManager.translateCallWait(primitiveCall, memory);
                break;
            case CONDVAR_NOTIFY_ONE:
            case CONDVAR_NOTIFY_ALL:
                condvarManager.translateCallNotify(primitiveCall, memory);
                break;
            case THREAD_SPAWN:
                threadManager.translateCallSpawn(primitiveCall, memory);
                break;
            case THREAD_JOIN:
                threadManager.translateCallJoin(primitiveCall, memory);
                break;
            case SHARED_NEW:
            case SHARED_CLONE:
            case SHARED_DEREF:
                sharedHandleManager.translateCall(call.getCalleeKind(), primitiveCall, memory);
                break;
            default:
                throw new IllegalStateException("Не примитив синхронизации: " + call.getCalleeKind());
        }
    }
}
