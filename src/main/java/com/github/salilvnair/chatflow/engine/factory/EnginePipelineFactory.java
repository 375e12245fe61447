package com.github.salilvnair.chatflow.engine.factory;

import com.github.salilvnair.chatflow.engine.exception.ChatFlowErrorCode;
import com.github.salilvnair.chatflow.engine.exception.ChatFlowException;
import com.github.salilvnair.chatflow.engine.hook.EngineStepHook;
import com.github.salilvnair.chatflow.engine.pipeline.EnginePipeline;
import com.github.salilvnair.chatflow.engine.pipeline.EngineStep;
import com.github.salilvnair.chatflow.engine.pipeline.StepResult;
import com.github.salilvnair.chatflow.engine.pipeline.annotation.MustRunAfter;
import com.github.salilvnair.chatflow.engine.pipeline.annotation.TerminalStep;
import com.github.salilvnair.chatflow.engine.session.EngineSession;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.support.AopUtils;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

@RequiredArgsConstructor
@Component
public class EnginePipelineFactory {

    private static final Logger log = LoggerFactory.getLogger(EnginePipelineFactory.class);

    private final List<EngineStep> discoveredSteps;
    private final List<EngineStepHook> stepHooks;

    private EnginePipeline pipeline;

    // ---------------------------------------------------------------------
    // Init
    // ---------------------------------------------------------------------
    @PostConstruct
    public void init() {
        List<EngineStep> ordered = orderByDag(discoveredSteps);
        log.info(
                "ChatFlow pipeline order: {}",
                ordered.stream()
                        .map(s -> stepClass(s).getSimpleName())
                        .collect(Collectors.joining(" -> "))
        );
        this.pipeline = new EnginePipeline(wrapWithHooks(ordered));
    }

    public EnginePipeline create() {
        return pipeline;
    }

    // ---------------------------------------------------------------------
    // DAG ordering using annotations
    // ---------------------------------------------------------------------
    List<EngineStep> orderByDag(List<EngineStep> steps) {
        Map<Class<?>, EngineStep> stepByClass = new LinkedHashMap<>();
        for (EngineStep s : steps) {
            if (stepByClass.put(stepClass(s), s) != null) {
                throw new ChatFlowException(
                        ChatFlowErrorCode.DUPLICATE_ENGINE_STEP,
                        "Duplicate EngineStep bean for class: " + stepClass(s).getName()
                );
            }
        }

        List<Class<?>> terminalSteps = stepByClass.keySet().stream()
                .filter(c -> c.getAnnotation(TerminalStep.class) != null)
                .toList();
        if (terminalSteps.size() != 1) {
            throw new ChatFlowException(
                    ChatFlowErrorCode.MISSING_TERMINAL_STEP,
                    "Exactly ONE @TerminalStep required, found: " +
                            terminalSteps.stream().map(Class::getSimpleName).collect(Collectors.joining(", "))
            );
        }
        Class<?> terminal = terminalSteps.get(0);

        Map<Class<?>, Set<Class<?>>> outgoing = new HashMap<>();
        Map<Class<?>, Set<Class<?>>> incoming = new HashMap<>();
        for (Class<?> c : stepByClass.keySet()) {
            outgoing.put(c, new LinkedHashSet<>());
            incoming.put(c, new LinkedHashSet<>());
        }

        // A must run after B => B -> A
        for (Class<?> c : stepByClass.keySet()) {
            MustRunAfter after = c.getAnnotation(MustRunAfter.class);
            if (after != null) {
                for (Class<? extends EngineStep> a : after.value()) {
                    if (!stepByClass.containsKey(a)) {
                        throw new ChatFlowException(
                                ChatFlowErrorCode.MISSING_DEPENDENT_STEP,
                                c.getSimpleName() + " depends on missing step: " + a.getName()
                        );
                    }
                    addEdge(outgoing, incoming, a, c);
                }
            }
        }

        for (Class<?> c : stepByClass.keySet()) {
            if (!c.equals(terminal)) {
                addEdge(outgoing, incoming, c, terminal);
            }
        }

        return topoSort(stepByClass.keySet(), outgoing, incoming).stream()
                .map(stepByClass::get)
                .toList();
    }

    private void addEdge(Map<Class<?>, Set<Class<?>>> outgoing,
                         Map<Class<?>, Set<Class<?>>> incoming,
                         Class<?> from,
                         Class<?> to) {
        if (from.equals(to)) return;
        if (outgoing.get(from).add(to)) {
            incoming.get(to).add(from);
        }
    }

    private List<Class<?>> topoSort(Set<Class<?>> nodes,
                                    Map<Class<?>, Set<Class<?>>> outgoing,
                                    Map<Class<?>, Set<Class<?>>> incoming) {
        Map<Class<?>, Integer> indegree = new HashMap<>();
        for (Class<?> n : nodes) {
            indegree.put(n, incoming.get(n).size());
        }

        PriorityQueue<Class<?>> q = new PriorityQueue<>(Comparator.comparing(Class::getName));
        indegree.forEach((k, v) -> {
            if (v == 0) q.add(k);
        });

        List<Class<?>> result = new ArrayList<>();
        while (!q.isEmpty()) {
            Class<?> n = q.poll();
            result.add(n);
            for (Class<?> m : outgoing.get(n)) {
                indegree.put(m, indegree.get(m) - 1);
                if (indegree.get(m) == 0) q.add(m);
            }
        }

        if (result.size() != nodes.size()) {
            Set<Class<?>> remaining = new LinkedHashSet<>(nodes);
            result.forEach(remaining::remove);
            throw new ChatFlowException(
                    ChatFlowErrorCode.PIPELINE_CYCLE,
                    "EngineStep DAG cycle or unsatisfied constraints: " +
                            remaining.stream().map(Class::getSimpleName).collect(Collectors.joining(" -> "))
            );
        }
        return result;
    }

    private static Class<?> stepClass(EngineStep step) {
        return AopUtils.getTargetClass(step);
    }

    // ---------------------------------------------------------------------
    // Hook wrapper
    // ---------------------------------------------------------------------
    private List<EngineStep> wrapWithHooks(List<EngineStep> steps) {
        return steps.stream()
                .map(s -> (EngineStep) new HookedEngineStep(s, stepHooks))
                .toList();
    }

    private static final class HookedEngineStep implements EngineStep {

        private final EngineStep delegate;
        private final String stepName;
        private final List<EngineStepHook> stepHooks;

        private HookedEngineStep(EngineStep delegate, List<EngineStepHook> stepHooks) {
            this.delegate = delegate;
            this.stepName = stepClass(delegate).getSimpleName();
            this.stepHooks = stepHooks == null ? List.of() : stepHooks;
        }

        @Override
        public StepResult execute(EngineSession session) {
            for (EngineStepHook hook : stepHooks) {
                runHookSafely(() -> {
                    if (hook.supports(stepName, session)) {
                        hook.beforeStep(stepName, session);
                    }
                }, hook, "beforeStep", session);
            }
            try {
                StepResult r = delegate.execute(session);
                for (EngineStepHook hook : stepHooks) {
                    runHookSafely(() -> {
                        if (hook.supports(stepName, session)) {
                            hook.afterStep(stepName, session, r);
                        }
                    }, hook, "afterStep", session);
                }
                return r;
            }
            catch (RuntimeException e) {
                for (EngineStepHook hook : stepHooks) {
                    runHookSafely(() -> {
                        if (hook.supports(stepName, session)) {
                            hook.onStepError(stepName, session, e);
                        }
                    }, hook, "onStepError", session);
                }
                throw e;
            }
        }

        private void runHookSafely(Runnable hookCall, EngineStepHook hook, String phase, EngineSession session) {
            try {
                hookCall.run();
            }
            catch (Exception ex) {
                log.warn(
                        "EngineStepHook {} failed during {} for step {} userId={}: {}",
                        hook.getClass().getSimpleName(),
                        phase,
                        stepName,
                        session.getUserId(),
                        ex.getMessage()
                );
            }
        }
    }
}
