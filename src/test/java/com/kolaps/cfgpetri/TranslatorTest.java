package com.kolaps.cfgpetri;

import com.google.common.base.VerifyException;
import com.kolaps.cfgpetri.cfg.Capture;
import com.kolaps.cfgpetri.cfg.ControlFlowGraph;
import com.kolaps.cfgpetri.cfg.FunctionId;
import com.kolaps.cfgpetri.cfg.InMemoryProgram;
import com.kolaps.cfgpetri.cfg.Location;
import com.kolaps.cfgpetri.cfg.Operand;
import com.kolaps.cfgpetri.cfg.Rvalue;
import com.kolaps.cfgpetri.cfg.Statement;
import com.kolaps.cfgpetri.cfg.Terminator;
import com.kolaps.cfgpetri.net.Arc;
import com.kolaps.cfgpetri.net.Node;
import com.kolaps.cfgpetri.net.PetriNet;
import com.kolaps.cfgpetri.net.Place;
import com.kolaps.cfgpetri.net.Transition;
import org.junit.After;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.kolaps.cfgpetri.Cfgs.*;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasItems;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TranslatorTest {

    @After
    public void resetOptions() {
        Options.INSTANCE.reset();
    }

    @Test
    public void onlyProgramStartIsMarkedBeforeTranslation() throws TranslationException {
        ControlFlowGraph main = cfg(MAIN)
                .block(call(MUTEX_NEW, 1, 1, Operand.constant()))
                .block(Terminator.returnTerminator())
                .build();
        Translator translator = new Translator(program(main));

        PetriNet before = translator.currentNet();
        assertThat(labels(before.getInitialMarking().keySet()), contains("PROGRAM_START"));
        assertThat(before.getInitialMarking().get(place(before, "PROGRAM_START")), is(1));
        assertThat(before.transitionCount(), is(0));

        translator.run();
        assertThat(labels(translator.getResult().getInitialMarking().keySet()),
                containsInAnyOrder("PROGRAM_START", "MUTEX_0_UNLOCKED"));
    }

    @Test
    public void entryThatReturnsImmediately() throws TranslationException {
        PetriNet net = translate(program(cfg(MAIN).block(Terminator.returnTerminator()).build()));

        assertThat(labels(net.getPlaces()), contains("PROGRAM_START", "PROGRAM_END", "PROGRAM_PANIC"));
        assertThat(labels(net.getTransitions()), contains("main__RETURN_0"));
        Transition ret = transition(net, "main__RETURN_0");
        assertThat(labels(net.getPreset(ret)), contains("PROGRAM_START"));
        assertThat(labels(net.getPostset(ret)), contains("PROGRAM_END"));
        assertThat(labels(net.getInitialMarking().keySet()), contains("PROGRAM_START"));
        assertThat(net.getInitialMarking().get(place(net, "PROGRAM_START")), is(1));
    }

    @Test
    public void blocksGetOwnPlacesExceptEntry() throws TranslationException {
        ControlFlowGraph main = cfg(MAIN)
                .block(Terminator.gotoBlock(1))
                .block(Terminator.gotoBlock(2), Statement.nop("StorageLive(_1)"), Statement.nop("StorageDead(_1)"))
                .block(Terminator.returnTerminator())
                .build();
        PetriNet net = translate(program(main));

        assertThat(labels(net.getPlaces()), containsInAnyOrder("PROGRAM_START", "PROGRAM_END", "PROGRAM_PANIC",
                "main__BASIC_BLOCK_1", "main__BASIC_BLOCK_2", "main__BLOCK_1_STATEMENT_0_END_PLACE",
                "main__BASIC_BLOCK_END_PLACE_1"));
        assertThat(labels(net.getPostset(transition(net, "main__GOTO_0"))), contains("main__BASIC_BLOCK_1"));
        assertThat(labels(net.getPreset(transition(net, "main__BLOCK_1_STATEMENT_1"))),
                contains("main__BLOCK_1_STATEMENT_0_END_PLACE"));
        assertThat(labels(net.getPreset(transition(net, "main__GOTO_1"))), contains("main__BASIC_BLOCK_END_PLACE_1"));
        assertThat(labels(net.getPostset(transition(net, "main__RETURN_2"))), contains("PROGRAM_END"));
        assertTrue(new ReachabilityExplorer(net).canMark("PROGRAM_END"));
    }

    @Test
    public void spawnAndJoinEmptyThread() throws TranslationException {
        FunctionId body = FunctionId.of("thread_body");
        ControlFlowGraph main = cfg(MAIN)
                .block(call(SPAWN, 1, 1, Operand.function(body)))
                .block(call(JOIN, 2, 2, move(1)))
                .block(Terminator.returnTerminator())
                .build();
        PetriNet net = translate(program(main, cfg(body).block(Terminator.returnTerminator()).build()));

        assertThat(net.placeCount(), is(3 + 2 + 2));
        Transition spawn = transition(net, "std_thread_spawn_0");
        assertThat(labels(net.getPostset(spawn)), containsInAnyOrder("main__BASIC_BLOCK_1", "THREAD_START_0"));

        Place threadEnd = place(net, "THREAD_END_0");
        List<Arc> out = net.getOutputArcs(threadEnd);
        assertThat(out.size(), is(1));
        assertThat(out.get(0).getTarget().getLabel(), is("std_thread_JoinHandle_T_join_0"));
        assertThat(labels(net.getPreset(transition(net, "thread_body__RETURN_0"))), contains("THREAD_START_0"));

        ReachabilityExplorer explorer = new ReachabilityExplorer(net);
        assertTrue(explorer.canMark("PROGRAM_END"));
        assertFalse(explorer.hasDeadlockWithout("PROGRAM_END"));
    }

    @Test
    public void spawnWithoutJoinLeavesThreadEndAsSink() throws TranslationException {
        FunctionId body = FunctionId.of("detached");
        ControlFlowGraph main = cfg(MAIN)
                .block(call(SPAWN, 1, 1, Operand.function(body)))
                .block(Terminator.returnTerminator())
                .build();
        PetriNet net = translate(program(main, cfg(body).block(Terminator.returnTerminator()).build()));

        assertThat(net.getOutputArcs(place(net, "THREAD_END_0")), is(empty()));
        assertTrue(new ReachabilityExplorer(net).canMark("THREAD_END_0"));
    }

    @Test
    public void foreignCallIsSingleTransition() throws TranslationException {
        ControlFlowGraph main = cfg(MAIN)
                .block(call(FunctionId.of("libc::write"), 1, 1, Operand.constant()))
                .block(Terminator.returnTerminator())
                .build();
        PetriNet net = translate(program(main));

        Transition call = transition(net, "main__BLOCK_0_libc_write_FOREIGN_CALL");
        assertThat(net.getInputArcs(call).size(), is(1));
        assertThat(net.getOutputArcs(call).size(), is(1));
        assertThat(net.getInputArcs(call).get(0).getSource().getLabel(), is("PROGRAM_START"));
        assertThat(net.getOutputArcs(call).get(0).getTarget().getLabel(), is("main__BASIC_BLOCK_1"));
        for (Arc arc : net.getArcs()) {
            assertThat(arc.getWeight(), is(1));
        }
        assertFalse(net.findTransition("main__BLOCK_0_libc_write_FOREIGN_CALL_UNWIND").isPresent());
    }

    @Test
    public void foreignCallWithCleanupUnwindsToCleanupBlock() throws TranslationException {
        ControlFlowGraph main = cfg(MAIN)
                .block(Terminator.call(FunctionId.of("ext"), Collections.<Operand>emptyList(), local(1), 1, 2))
                .block(Terminator.returnTerminator())
                .block(Terminator.resume())
                .build();
        PetriNet net = translate(program(main));

        Transition unwind = transition(net, "main__BLOCK_0_ext_FOREIGN_CALL_UNWIND");
        assertThat(labels(net.getPreset(unwind)), contains("PROGRAM_START"));
        assertThat(labels(net.getPostset(unwind)), contains("main__BASIC_BLOCK_2"));
        assertThat(labels(net.getPostset(transition(net, "main__UNWIND_2"))), contains("PROGRAM_PANIC"));
    }

    @Test
    public void mutexLockConsumesUnlockedAndGuardDropReleases() throws TranslationException {
        ControlFlowGraph main = cfg(MAIN)
                .block(call(MUTEX_NEW, 1, 1, Operand.constant()))
                .block(call(MUTEX_LOCK, 2, 2, move(3)), ref(3, 1))
                .block(Terminator.drop(local(2), 3))
                .block(Terminator.returnTerminator())
                .build();
        PetriNet net = translate(program(main));

        Place unlocked = place(net, "MUTEX_0_UNLOCKED");
        assertThat(unlocked.getTokens(), is(1));
        assertThat(place(net, "MUTEX_0_LOCKED").getTokens(), is(0));

        Transition lock = transition(net, "std_sync_Mutex_T_lock_0");
        assertThat(labels(net.getPreset(lock)), containsInAnyOrder("main__BASIC_BLOCK_END_PLACE_1", "MUTEX_0_UNLOCKED"));
        assertThat(labels(net.getPostset(lock)), containsInAnyOrder("main__BASIC_BLOCK_2", "MUTEX_0_LOCKED"));

        Transition drop = transition(net, "main__DROP_2");
        assertThat(labels(net.getPreset(drop)), hasItem("MUTEX_0_LOCKED"));
        assertThat(labels(net.getPostset(drop)), hasItem("MUTEX_0_UNLOCKED"));

        assertFalse(new ReachabilityExplorer(net).hasDeadlockWithout("PROGRAM_END"));
    }

    @Test
    public void secondLockWithoutUnlockIsNeverEnabled() throws TranslationException {
        ControlFlowGraph main = cfg(MAIN)
                .block(call(MUTEX_NEW, 1, 1, Operand.constant()))
                .block(call(MUTEX_LOCK, 2, 2, move(3)), ref(3, 1))
                .block(call(MUTEX_LOCK, 5, 3, move(4)), ref(4, 1))
                .block(Terminator.returnTerminator())
                .build();
        PetriNet net = translate(program(main));

        ReachabilityExplorer explorer = new ReachabilityExplorer(net);
        assertTrue(explorer.canFire("std_sync_Mutex_T_lock_0"));
        assertFalse(explorer.canFire("std_sync_Mutex_T_lock_1"));
        assertFalse(explorer.canMark("PROGRAM_END"));
    }

    @Test
    public void lockUnwindDoesNotTouchMutex() throws TranslationException {
        ControlFlowGraph main = cfg(MAIN)
                .block(call(MUTEX_NEW, 1, 1, Operand.constant()))
                .block(Terminator.call(MUTEX_LOCK, Arrays.asList(move(3)), local(2), 2, 3), ref(3, 1))
                .block(Terminator.returnTerminator())
                .block(Terminator.resume())
                .build();
        PetriNet net = translate(program(main));

        Transition unwind = transition(net, "std_sync_Mutex_T_lock_0_UNWIND");
        assertThat(labels(net.getPreset(unwind)), contains("main__BASIC_BLOCK_END_PLACE_1"));
        assertThat(labels(net.getPostset(unwind)), contains("main__BASIC_BLOCK_3"));
    }

    @Test
    public void mutexSharedWithThreadThroughArc() throws TranslationException {
        FunctionId worker = FunctionId.of("worker");
        ControlFlowGraph main = cfg(MAIN)
                .block(call(MUTEX_NEW, 1, 1, Operand.constant()))
                .block(call(ARC_NEW, 2, 2, move(1)))
                .block(call(CLONE, 3, 3, move(4)), ref(4, 2))
                .block(call(SPAWN, 6, 4, Operand.closure(local(5), worker)), aggregate(5, move(3)))
                .block(call(DEREF, 7, 5, move(8)), ref(8, 2))
                .block(call(MUTEX_LOCK, 9, 6, copy(7)))
                .block(Terminator.drop(local(9), 7))
                .block(call(JOIN, 10, 8, move(6)))
                .block(Terminator.returnTerminator())
                .build();
        ControlFlowGraph workerCfg = cfg(worker)
                .capture(Capture.mutex(local(1).field(0)))
                .block(call(DEREF, 2, 1, move(3)), ref(3, local(1).field(0)))
                .block(call(MUTEX_LOCK, 4, 2, copy(2)))
                .block(Terminator.drop(local(4), 3))
                .block(Terminator.returnTerminator())
                .build();
        PetriNet net = translate(program(main, workerCfg));

        assertFalse(net.findPlace("MUTEX_1_UNLOCKED").isPresent());
        assertThat(labels(net.getPreset(transition(net, "std_sync_Mutex_T_lock_0"))), hasItem("MUTEX_0_UNLOCKED"));
        assertThat(labels(net.getPreset(transition(net, "std_sync_Mutex_T_lock_1"))), hasItem("MUTEX_0_UNLOCKED"));
        assertThat(labels(net.getPreset(transition(net, "std_sync_Mutex_T_lock_1"))),
                hasItem("worker__BASIC_BLOCK_1"));
        assertTrue(net.findTransition("std_sync_Arc_T_new_0").isPresent());
        assertTrue(net.findTransition("std_clone_Clone_clone_0").isPresent());
        assertTrue(net.findTransition("std_ops_Deref_deref_1").isPresent());

        ReachabilityExplorer explorer = new ReachabilityExplorer(net);
        assertTrue(explorer.canMark("PROGRAM_END"));
        assertFalse(explorer.hasDeadlockWithout("PROGRAM_END"));
    }

    @Test
    public void condvarWaitAndNotifyWithLostSignal() throws TranslationException {
        FunctionId notifier = FunctionId.of("notifier");
        ControlFlowGraph main = cfg(MAIN)
                .block(call(MUTEX_NEW, 1, 1, Operand.constant()))
                .block(call(CONDVAR_NEW, 2, 2))
                .block(call(SPAWN, 4, 3, Operand.closure(local(3), notifier)), aggregate(3, copy(1), copy(2)))
                .block(call(MUTEX_LOCK, 7, 4, move(8)), ref(8, 1))
                .block(call(CONDVAR_WAIT, 9, 5, move(10), move(7)), ref(10, 2))
                .block(Terminator.drop(local(9), 6))
                .block(call(JOIN, 11, 7, move(4)))
                .block(Terminator.returnTerminator())
                .build();
        ControlFlowGraph notifierCfg = cfg(notifier)
                .capture(Capture.mutex(local(1).field(0)))
                .capture(Capture.condvar(local(1).field(1)))
                .block(call(MUTEX_LOCK, 2, 1, move(3)), ref(3, local(1).field(0)))
                .block(call(NOTIFY_ONE, 4, 2, move(5)), ref(5, local(1).field(1)))
                .block(Terminator.drop(local(2), 3))
                .block(Terminator.returnTerminator())
                .build();
        PetriNet net = translate(program(main, notifierCfg));

        assertThat(place(net, "CONDVAR_0_NOT_WAITING").getTokens(), is(1));
        Transition waitStart = transition(net, "std_sync_Condvar_wait_0_WAIT_START");
        assertThat(labels(net.getPreset(waitStart)), containsInAnyOrder(
                "main__BASIC_BLOCK_END_PLACE_4", "CONDVAR_0_NOT_WAITING", "MUTEX_0_LOCKED"));
        assertThat(labels(net.getPostset(waitStart)), containsInAnyOrder(
                "MUTEX_0_UNLOCKED", "CONDVAR_0_WAITING", "std_sync_Condvar_wait_0_WAITING_PLACE"));

        Transition waitEnd = transition(net, "std_sync_Condvar_wait_0_WAIT_END");
        assertThat(labels(net.getPreset(waitEnd)), containsInAnyOrder(
                "std_sync_Condvar_wait_0_WAITING_PLACE", "CONDVAR_0_NOTIFIED", "MUTEX_0_UNLOCKED"));
        assertThat(labels(net.getPostset(waitEnd)), containsInAnyOrder("MUTEX_0_LOCKED", "main__BASIC_BLOCK_5"));

        Transition notify = transition(net, "std_sync_Condvar_notify_one_0");
        assertThat(labels(net.getPreset(notify)), containsInAnyOrder("notifier__BASIC_BLOCK_END_PLACE_1",
                "CONDVAR_0_WAITING"));
        assertThat(labels(net.getPostset(notify)), containsInAnyOrder("notifier__BASIC_BLOCK_2",
                "CONDVAR_0_NOTIFIED", "CONDVAR_0_NOT_WAITING"));
        Transition lost = transition(net, "std_sync_Condvar_notify_one_0_LOST");
        assertThat(labels(net.getPreset(lost)), hasItem("CONDVAR_0_NOT_WAITING"));
        assertThat(labels(net.getPostset(lost)), hasItems("CONDVAR_0_NOT_WAITING", "notifier__BASIC_BLOCK_2"));

        // guard, возвращенный из wait, освобождает тот же мьютекс
        assertThat(labels(net.getPreset(transition(net, "main__DROP_5"))), hasItem("MUTEX_0_LOCKED"));

        ReachabilityExplorer explorer = new ReachabilityExplorer(net);
        assertTrue(explorer.canMark("PROGRAM_END"));
        assertTrue(explorer.hasDeadlockWithout("PROGRAM_END"));
    }

    @Test
    public void handlesPassThroughArgumentsAndReturnValue() throws TranslationException {
        FunctionId helper = FunctionId.of("helper");
        ControlFlowGraph main = cfg(MAIN)
                .block(call(MUTEX_NEW, 1, 1, Operand.constant()))
                .block(call(helper, 2, 2, move(3)), ref(3, 1))
                .block(call(MUTEX_LOCK, 4, 3, move(2)))
                .block(Terminator.returnTerminator())
                .build();
        ControlFlowGraph helperCfg = cfg(helper)
                .block(Terminator.returnTerminator(),
                        Statement.assign(Location.RETURN_VALUE, Rvalue.use(copy(1))))
                .build();
        PetriNet net = translate(program(main, helperCfg));

        assertThat(labels(net.getPreset(transition(net, "helper__BLOCK_0_STATEMENT_0"))),
                contains("main__BASIC_BLOCK_END_PLACE_1"));
        assertThat(labels(net.getPostset(transition(net, "helper__RETURN_0"))), contains("main__BASIC_BLOCK_2"));
        assertThat(labels(net.getPreset(transition(net, "std_sync_Mutex_T_lock_0"))), hasItem("MUTEX_0_UNLOCKED"));
    }

    @Test
    public void everyActivationGetsItsOwnLabels() throws TranslationException {
        FunctionId helper = FunctionId.of("helper");
        ControlFlowGraph main = cfg(MAIN)
                .block(call(helper, 1, 1))
                .block(call(helper, 2, 2))
                .block(Terminator.returnTerminator())
                .build();
        PetriNet net = translate(program(main, cfg(helper).block(Terminator.returnTerminator()).build()));

        assertThat(labels(net.getPostset(transition(net, "helper__RETURN_0"))), contains("main__BASIC_BLOCK_1"));
        assertThat(labels(net.getPostset(transition(net, "helper_1__RETURN_0"))), contains("main__BASIC_BLOCK_2"));
        assertUniqueLabels(net);
    }

    @Test
    public void resumeInCalleeGoesToCallerCleanup() throws TranslationException {
        FunctionId helper = FunctionId.of("helper");
        ControlFlowGraph main = cfg(MAIN)
                .block(Terminator.call(helper, Collections.<Operand>emptyList(), local(1), 1, 2))
                .block(Terminator.returnTerminator())
                .block(Terminator.resume())
                .build();
        ControlFlowGraph helperCfg = cfg(helper)
                .block(Terminator.switchInt(1, 2))
                .block(Terminator.returnTerminator())
                .block(Terminator.resume())
                .build();
        PetriNet net = translate(program(main, helperCfg));

        assertThat(labels(net.getPostset(transition(net, "helper__UNWIND_2"))), contains("main__BASIC_BLOCK_2"));
        assertThat(labels(net.getPostset(transition(net, "main__UNWIND_2"))), contains("PROGRAM_PANIC"));
        assertTrue(new ReachabilityExplorer(net).canMark("PROGRAM_PANIC"));
    }

    @Test
    public void switchCreatesOneTransitionPerDistinctTarget() throws TranslationException {
        ControlFlowGraph main = cfg(MAIN)
                .block(Terminator.switchInt(1, 2, 1))
                .block(Terminator.returnTerminator())
                .block(Terminator.returnTerminator())
                .build();
        PetriNet net = translate(program(main));

        List<String> successors = new ArrayList<>();
        for (Arc arc : net.getOutputArcs(place(net, "PROGRAM_START"))) {
            successors.add(arc.getTarget().getLabel());
        }
        assertThat(successors, containsInAnyOrder("main__SWITCH_INT_0_1", "main__SWITCH_INT_0_2"));
    }

    @Test
    public void divergingCallIsDeadEnd() throws TranslationException {
        ControlFlowGraph main = cfg(MAIN)
                .block(Terminator.divergingCall(FunctionId.of("std::process::exit"),
                        Arrays.asList(Operand.constant()), local(1)))
                .build();
        PetriNet net = translate(program(main));

        Transition exit = transition(net, "main__BLOCK_0_std_process_exit_DIVERGING_CALL");
        assertThat(labels(net.getPreset(exit)), contains("PROGRAM_START"));
        assertThat(net.getPostset(exit), is(empty()));
        assertThat(net.getInputArcs(place(net, "PROGRAM_END")), is(empty()));
    }

    @Test
    public void divergingThreadDoesNotEndBlockedMain() throws TranslationException {
        FunctionId spinner = FunctionId.of("spinner");
        ControlFlowGraph main = cfg(MAIN)
                .block(call(MUTEX_NEW, 1, 1, Operand.constant()))
                .block(call(SPAWN, 2, 2, Operand.function(spinner)))
                .block(call(MUTEX_LOCK, 3, 3, move(4)), ref(4, 1))
                .block(call(MUTEX_LOCK, 5, 4, move(6)), ref(6, 1))
                .block(Terminator.returnTerminator())
                .build();
        ControlFlowGraph spinnerCfg = cfg(spinner)
                .block(Terminator.divergingCall(FunctionId.of("forever"), Collections.<Operand>emptyList(), local(0)))
                .build();
        PetriNet net = translate(program(main, spinnerCfg));

        ReachabilityExplorer explorer = new ReachabilityExplorer(net);
        assertTrue(explorer.canFire("spinner__BLOCK_0_forever_DIVERGING_CALL"));
        assertFalse(explorer.canFire("main__RETURN_4"));
        assertFalse(explorer.canMark("PROGRAM_END"));
    }

    @Test
    public void panicGoesToProgramPanic() throws TranslationException {
        ControlFlowGraph main = cfg(MAIN)
                .block(call(FunctionId.of("core::panicking::panic"), 1, 1, Operand.constant()))
                .block(Terminator.returnTerminator())
                .build();
        PetriNet net = translate(program(main));

        Transition panic = transition(net, "main__BLOCK_0_core_panicking_panic_PANIC");
        assertThat(labels(net.getPostset(panic)), contains("PROGRAM_PANIC"));
        assertThat(net.getInputArcs(place(net, "main__BASIC_BLOCK_1")), is(empty()));
    }

    @Test
    public void assertAndDropWithCleanup() throws TranslationException {
        ControlFlowGraph main = cfg(MAIN)
                .block(Terminator.assertTerminator(1, 3))
                .block(Terminator.drop(local(1), 2, 3))
                .block(Terminator.returnTerminator())
                .block(Terminator.resume())
                .build();
        PetriNet net = translate(program(main));

        assertThat(labels(net.getPostset(transition(net, "main__ASSERT_0"))), contains("main__BASIC_BLOCK_1"));
        assertThat(labels(net.getPostset(transition(net, "main__ASSERT_CLEANUP_0"))), contains("main__BASIC_BLOCK_3"));
        assertThat(labels(net.getPostset(transition(net, "main__DROP_1"))), contains("main__BASIC_BLOCK_2"));
        assertThat(labels(net.getPostset(transition(net, "main__DROP_UNWIND_1"))), contains("main__BASIC_BLOCK_3"));
    }

    @Test
    public void unreachableTerminatorHasNoTransition() throws TranslationException {
        PetriNet net = translate(program(cfg(MAIN).block(Terminator.unreachable()).build()));

        assertThat(net.transitionCount(), is(0));
        assertThat(net.getOutputArcs(place(net, "PROGRAM_START")), is(empty()));
    }

    @Test
    public void recursiveCallIsCutWhenEnabled() throws TranslationException {
        Options.INSTANCE.setOption("translator.skip_recursive_calls", true);
        FunctionId rec = FunctionId.of("rec");
        ControlFlowGraph main = cfg(MAIN)
                .block(call(rec, 1, 1))
                .block(Terminator.returnTerminator())
                .build();
        ControlFlowGraph recCfg = cfg(rec)
                .block(call(rec, 1, 1))
                .block(Terminator.returnTerminator())
                .build();
        PetriNet net = translate(program(main, recCfg));

        assertTrue(net.findTransition("rec__BLOCK_0_rec_RECURSIVE_CALL").isPresent());
        assertFalse(net.findTransition("rec_1__RETURN_1").isPresent());
    }

    @Test(expected = TranslationException.class)
    public void programWithoutEntryPointHasNoResult() throws TranslationException {
        InMemoryProgram program = InMemoryProgram.builder()
                .function(cfg("lib_fn").block(Terminator.returnTerminator()).build())
                .build();
        Translator translator = new Translator(program);
        translator.run();
        translator.getResult();
    }

    @Test(expected = IllegalStateException.class)
    public void resultBeforeRunIsAnError() throws TranslationException {
        new Translator(program(cfg(MAIN).block(Terminator.returnTerminator()).build())).getResult();
    }

    @Test(expected = IllegalStateException.class)
    public void runTwiceIsAnError() {
        Translator translator = new Translator(program(cfg(MAIN).block(Terminator.returnTerminator()).build()));
        translator.run();
        translator.run();
    }

    @Test
    public void lockOfUnknownLocationStopsTranslation() {
        ControlFlowGraph main = cfg(MAIN)
                .block(call(MUTEX_LOCK, 2, 1, move(3)))
                .block(Terminator.returnTerminator())
                .build();
        Translator translator = new Translator(program(main));
        try {
            translator.run();
            fail("Ожидалась VerifyException");
        } catch (VerifyException e) {
            assertThat(e.getMessage().contains("_3"), is(true));
        }
    }

    @Test(expected = VerifyException.class)
    public void threadDeclaringMoreCapturesThanMovedFails() {
        FunctionId body = FunctionId.of("body");
        ControlFlowGraph main = cfg(MAIN)
                .block(call(SPAWN, 1, 1, Operand.function(body)))
                .block(Terminator.returnTerminator())
                .build();
        ControlFlowGraph bodyCfg = cfg(body)
                .capture(Capture.mutex(local(1).field(0)))
                .block(Terminator.returnTerminator())
                .build();
        new Translator(program(main, bodyCfg)).run();
    }

    @Test
    public void functionNamedLikeCallerLabelDoesNotCollide() throws TranslationException {
        FunctionId mainDrop = FunctionId.of("main_DROP");
        ControlFlowGraph main = cfg(MAIN)
                .block(call(mainDrop, 1, 1))
                .block(Terminator.drop(local(2), 2, 3))
                .block(Terminator.returnTerminator())
                .block(Terminator.resume())
                .build();
        ControlFlowGraph mainDropCfg = cfg(mainDrop)
                .block(Terminator.returnTerminator())
                .block(Terminator.resume())
                .build();
        PetriNet net = translate(program(main, mainDropCfg));

        assertUniqueLabels(net);
        assertThat(labels(net.getPostset(transition(net, "main__DROP_UNWIND_1"))), contains("main__BASIC_BLOCK_3"));
        assertThat(labels(net.getPreset(transition(net, "main_DROP__UNWIND_1"))), contains("main_DROP__BASIC_BLOCK_1"));
    }

    @Test
    public void labelsAreUniqueInLargerProgram() throws TranslationException {
        FunctionId worker = FunctionId.of("worker");
        ControlFlowGraph main = cfg(MAIN)
                .block(call(MUTEX_NEW, 1, 1, Operand.constant()))
                .block(call(SPAWN, 3, 2, Operand.closure(local(2), worker)), aggregate(2, copy(1)))
                .block(call(SPAWN, 4, 3, Operand.closure(local(5), worker)), aggregate(5, copy(1)))
                .block(call(JOIN, 6, 4, move(3)))
                .block(call(JOIN, 7, 5, move(4)))
                .block(Terminator.returnTerminator())
                .build();
        ControlFlowGraph workerCfg = cfg(worker)
                .capture(Capture.mutex(local(1).field(0)))
                .block(call(MUTEX_LOCK, 2, 1, move(3)), ref(3, local(1).field(0)))
                .block(Terminator.drop(local(2), 2))
                .block(Terminator.returnTerminator())
                .build();
        PetriNet net = translate(program(main, workerCfg));

        assertUniqueLabels(net);
        assertTrue(net.findTransition("worker_1__RETURN_2").isPresent());
        assertThat(net.getOutputArcs(place(net, "THREAD_END_1")).size(), is(1));
        assertFalse(new ReachabilityExplorer(net).hasDeadlockWithout("PROGRAM_END"));
    }

    private static void assertUniqueLabels(PetriNet net) {
        Set<String> seen = new HashSet<>();
        for (Place place : net.getPlaces()) {
            assertTrue(place.getLabel(), seen.add(place.getLabel()));
        }
        for (Transition transition : net.getTransitions()) {
            assertTrue(transition.getLabel(), seen.add(transition.getLabel()));
        }
        assertThat(seen, not(hasItem("")));
    }

    private static Place place(PetriNet net, String label) {
        return net.findPlace(label).orElseThrow(() -> new AssertionError("Нет места " + label));
    }

    private static Transition transition(PetriNet net, String label) {
        return net.findTransition(label).orElseThrow(() -> new AssertionError("Нет перехода " + label));
    }

    private static List<String> labels(Collection<? extends Node> nodes) {
        List<String> result = new ArrayList<>();
        for (Node node : nodes) {
            result.add(node.getLabel());
        }
        return result;
    }
}
