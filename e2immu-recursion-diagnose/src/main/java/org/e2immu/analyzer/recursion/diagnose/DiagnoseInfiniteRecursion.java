package org.e2immu.analyzer.recursion.diagnose;

import org.e2immu.analyzer.recursion.common.*;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/*
Diagnostic pass: warns about recursive calls which cause an infinite recursion.

Detects simple forms like

    func f() { f() }

and deals with invariant conditions, e.g. on forwarded arguments:

    func f(_ x: Int) { if x > 0 { f(x) } }

Each function is analyzed independently; the pass holds no mutable state across functions.
 */
public class DiagnoseInfiniteRecursion {
    private static final Logger LOGGER = LoggerFactory.getLogger(DiagnoseInfiniteRecursion.class);
    public static final int DEFAULT_MAX_INVARIANTS_TO_TRY = 4;

    public record Options(int maxInvariantsToTry,
                          boolean tryInvariantMemory,
                          boolean skipDeserialized,
                          boolean parallel) {
        public Options {
            if (maxInvariantsToTry < 1) {
                throw new IllegalArgumentException("Need at least one set of invariants, got " + maxInvariantsToTry);
            }
        }

        public static class Builder {
            int maxInvariantsToTry = DEFAULT_MAX_INVARIANTS_TO_TRY;
            boolean tryInvariantMemory = true;
            boolean skipDeserialized = true;
            boolean parallel;

            public Builder setMaxInvariantsToTry(int maxInvariantsToTry) {
                this.maxInvariantsToTry = maxInvariantsToTry;
                return this;
            }

            public Builder setTryInvariantMemory(boolean tryInvariantMemory) {
                this.tryInvariantMemory = tryInvariantMemory;
                return this;
            }

            public Builder setSkipDeserialized(boolean skipDeserialized) {
                this.skipDeserialized = skipDeserialized;
                return this;
            }

            public Builder setParallel(boolean parallel) {
                this.parallel = parallel;
                return this;
            }

            public Options build() {
                return new Options(maxInvariantsToTry, tryInvariantMemory, skipDeserialized, parallel);
            }
        }
    }

    private final CallClassifier callClassifier;
    private final DiagnosticSink diagnosticSink;
    private final Options options;

    public DiagnoseInfiniteRecursion(CallTargetResolver callTargetResolver, DiagnosticSink diagnosticSink) {
        this(callTargetResolver, diagnosticSink, new Options.Builder().build());
    }

    public DiagnoseInfiniteRecursion(@NotNull CallTargetResolver callTargetResolver,
                                     @NotNull DiagnosticSink diagnosticSink,
                                     @NotNull Options options) {
        this.callClassifier = new CallClassifier(callTargetResolver);
        this.diagnosticSink = diagnosticSink;
        this.options = options;
    }

    public static List<Function> doModule(CfgModule module, DiagnosticSink diagnosticSink, Options options) {
        LOGGER.info("Start infinite recursion analysis of module {}", module.name());
        DiagnoseInfiniteRecursion pass = new DiagnoseInfiniteRecursion(module.callTargetResolver(), diagnosticSink,
                options);
        return pass.doFunctions(module.functions());
    }

    /**
     * @return the functions in which at least one infinite recursion has been diagnosed, in the order of the input
     */
    public List<Function> doFunctions(Collection<Function> functions) {
        AtomicInteger count = new AtomicInteger();
        Stream<Function> stream = options.parallel() ? functions.parallelStream() : functions.stream();
        List<Function> result = stream.filter(function -> {
            try {
                return doFunction(function);
            } catch (RuntimeException re) {
                LOGGER.error("Caught exception in infinite recursion analysis, processed {}, failing on function {}",
                        count.get(), function.name());
                throw re;
            } finally {
                count.incrementAndGet();
            }
        }).toList();
        LOGGER.info("Analyzed {} functions, found infinite recursion in {}", count.get(), result.size());
        return result;
    }

    /**
     * @return true when an infinite recursion has been diagnosed in this function
     */
    public boolean doFunction(Function function) {
        // don't rerun diagnostics on deserialized functions
        if (options.skipDeserialized() && function.isDeserialized()) {
            LOGGER.debug("Skipping deserialized function {}", function.name());
            return false;
        }
        InvariantsToTry invariantsToTry = InvariantsToTry.collect(function, callClassifier,
                options.maxInvariantsToTry());
        if (!invariantsToTry.recursiveCallsFound()) {
            // the case for most functions
            return false;
        }
        LOGGER.debug("Function {}: invariants to try {}", function.name(), invariantsToTry);

        for (Invariants invariants : invariantsToTry) {
            if (InfiniteRecursionAnalysis.analyzeAndDiagnose(function, invariants, callClassifier, diagnosticSink)) {
                return true;
            }
            if (options.tryInvariantMemory()
                && InfiniteRecursionAnalysis.analyzeAndDiagnose(function, invariants.withInvariantMemory(),
                    callClassifier, diagnosticSink)) {
                return true;
            }
        }
        return false;
    }
}
