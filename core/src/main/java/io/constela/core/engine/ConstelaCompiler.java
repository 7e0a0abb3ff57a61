package io.constela.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.constela.core.analysis.A11yValidator;
import io.constela.core.analysis.AnalysisResult;
import io.constela.core.analysis.Analyzer;
import io.constela.core.analysis.LayoutAnalyzer;
import io.constela.core.error.ConstelaError;
import io.constela.core.ir.CompiledNode;
import io.constela.core.ir.CompiledProgram;
import io.constela.core.ir.CompiledViewStats;
import io.constela.core.model.Expression;
import io.constela.core.model.Program;
import io.constela.core.schema.ProgramReader;
import io.constela.core.schema.SchemaValidator;
import io.constela.core.schema.ValidationResult;
import io.constela.core.spi.CompileListener;
import io.constela.core.transform.LayoutComposer;
import io.constela.core.transform.Transformer;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the compiler: validate, analyze, lower. Layouts go through the same pipeline with
 * the layout slot rules and are then composed with compiled pages.
 *
 * <p>
 * The pipeline is fail-fast between passes. A validation failure returns its single error without
 * running analysis; an analysis failure returns all analyzer errors without lowering. Lowering only
 * runs on an analyzed program, and an {@link io.constela.core.error.InternalCompilerException} it
 * throws propagates to the caller instead of becoming a {@link ConstelaError}. Accessibility findings
 * on an analyzed program are returned as warnings with the successful result.
 *
 * <p>
 * Thread-safe: the compiler holds only its configuration and an optional listener, and the
 * passes keep their per-run state on the stack. One instance can serve concurrent callers.
 */
public final class ConstelaCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(ConstelaCompiler.class);

    private final CompilerConfig config;
    private final SchemaValidator validator;
    private final Analyzer analyzer;
    private final LayoutAnalyzer layoutAnalyzer;
    private final Transformer transformer;
    private final CompileListener listener;

    /** Creates a compiler with {@link CompilerConfig#DEFAULT} and no listener. */
    public ConstelaCompiler() {
        this(CompilerConfig.DEFAULT, null);
    }

    public ConstelaCompiler(CompilerConfig config) {
        this(config, null);
    }

    /**
     * @param config   compiler tunables
     * @param listener optional observer of compile runs, or {@code null}
     */
    public ConstelaCompiler(CompilerConfig config, CompileListener listener) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.validator = new SchemaValidator(config.maxDepth());
        this.analyzer = new Analyzer(
                config.maxExpandedDepth(), config.suggestionDistance(), config.maxExpandedNodes());
        this.layoutAnalyzer = new LayoutAnalyzer(analyzer);
        this.transformer = new Transformer(config.maxExpandedDepth());
        this.listener = listener; // nullable
    }

    public CompilerConfig config() {
        return config;
    }

    public CompileResult compile(JsonNode raw) {
        return compile(raw, null);
    }

    /**
     * Compiles a raw program document.
     *
     * @param raw          the parsed JSON document; {@code null} and non-object values fail
     *                     validation like any other malformed input
     * @param knownLayouts layout names {@code route.layout} may refer to, or {@code null} to skip
     *                     that check
     */
    public CompileResult compile(JsonNode raw, Set<String> knownLayouts) {
        return run(raw, knownLayouts, false);
    }

    /**
     * Compiles a layout document. The result keeps the layout's slots and top-level params for
     * {@link #composeLayout}.
     */
    public CompileResult compileLayout(JsonNode raw) {
        return run(raw, null, true);
    }

    /** Composes a compiled layout with a compiled page, using the page's {@code route.layoutParams}. */
    public CompiledProgram composeLayout(CompiledProgram layout, CompiledProgram page) {
        return LayoutComposer.compose(layout, page);
    }

    /**
     * @param layoutParams expressions bound to the layout's params, or {@code null} for the page's own
     * @param namedSlots   content for named slots, or {@code null}
     */
    public CompiledProgram composeLayout(
            CompiledProgram layout,
            CompiledProgram page,
            Map<String, Expression> layoutParams,
            Map<String, CompiledNode> namedSlots) {
        return LayoutComposer.compose(layout, page, layoutParams, namedSlots);
    }

    private CompileResult run(JsonNode raw, Set<String> knownLayouts, boolean layout) {
        long start = System.nanoTime();
        String routePath = routePathOf(raw);
        notifyStarted(routePath);

        ValidationResult validation = validator.validate(raw);
        if (!validation.isSuccess()) {
            ConstelaError error = validation.error();
            long durationMs = elapsedMs(start);
            LOG.warn("Compile failed: validation error {} at '{}'", error.code(), error.path());
            notifyValidationFailed(error, durationMs);
            return CompileResult.failure(List.of(error));
        }

        Program program = validation.program();
        AnalysisResult analysis =
                layout ? layoutAnalyzer.analyze(program) : analyzer.analyze(program, knownLayouts);
        if (!analysis.isSuccess()) {
            List<ConstelaError> errors = analysis.errors();
            long durationMs = elapsedMs(start);
            LOG.warn(
                    "Compile failed: {} analysis error(s), first {}",
                    errors.size(),
                    errors.get(0).code());
            notifyAnalysisFailed(errors, durationMs);
            return CompileResult.failure(errors);
        }

        List<ConstelaError> warnings = A11yValidator.validate(program);
        if (!warnings.isEmpty()) {
            LOG.debug("Accessibility check reported {} warning(s), first {}", warnings.size(), warnings.get(0).code());
        }
        Transformer.Lowering lowering = layout
                ? transformer.lowerLayout(program, analysis.context())
                : transformer.lower(program, analysis.context());
        long durationMs = elapsedMs(start);
        if (LOG.isDebugEnabled()) {
            CompiledViewStats stats = CompiledViewStats.of(lowering.program().view());
            LOG.debug(
                    "Lowered view: nodes={}, local_states={}, depth={}",
                    stats.nodes(),
                    stats.localStates(),
                    stats.maxDepth());
        }
        LOG.info(
                "Compiled {}: route={}, actions={}, inlined_components={}, duration_ms={}",
                layout ? "layout" : "program",
                routePath == null ? "<none>" : routePath,
                lowering.program().actions().size(),
                lowering.inlinedComponents(),
                durationMs);
        notifyCompleted(routePath, lowering, durationMs);
        return CompileResult.success(lowering.program(), warnings);
    }

    /**
     * Parses {@code json} and compiles it.
     *
     * @throws io.constela.core.error.ProgramReadException if {@code json} is not valid JSON
     */
    public CompileResult compile(String json) {
        return compile(ProgramReader.readJson(json));
    }

    public ValidationResult validate(JsonNode raw) {
        return validator.validate(raw);
    }

    public AnalysisResult analyze(Program program) {
        return analyzer.analyze(program);
    }

    /** Analyzes a layout program: regular checks plus the slot rules. */
    public AnalysisResult analyzeLayout(Program layout) {
        return layoutAnalyzer.analyze(layout);
    }

    private static String routePathOf(JsonNode raw) {
        if (raw == null) {
            return null;
        }
        JsonNode path = raw.path("route").path("path");
        return path.isTextual() ? path.asText() : null;
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    // ── Listener notification ──

    private void notifyStarted(String routePath) {
        if (listener == null) return;
        try {
            listener.onCompileStarted(new CompileListener.CompileStartedEvent(routePath));
        } catch (Exception e) {
            LOG.warn("CompileListener.onCompileStarted failed", e);
        }
    }

    private void notifyValidationFailed(ConstelaError error, long durationMs) {
        if (listener == null) return;
        try {
            listener.onValidationFailed(
                    new CompileListener.ValidationFailedEvent(error.code(), error.path(), durationMs));
        } catch (Exception e) {
            LOG.warn("CompileListener.onValidationFailed failed", e);
        }
    }

    private void notifyAnalysisFailed(List<ConstelaError> errors, long durationMs) {
        if (listener == null) return;
        try {
            listener.onAnalysisFailed(
                    new CompileListener.AnalysisFailedEvent(errors.size(), errors.get(0).code(), durationMs));
        } catch (Exception e) {
            LOG.warn("CompileListener.onAnalysisFailed failed", e);
        }
    }

    private void notifyCompleted(String routePath, Transformer.Lowering lowering, long durationMs) {
        if (listener == null) return;
        try {
            listener.onCompileCompleted(new CompileListener.CompileCompletedEvent(
                    routePath,
                    lowering.program().actions().size(),
                    lowering.inlinedComponents(),
                    durationMs));
        } catch (Exception e) {
            LOG.warn("CompileListener.onCompileCompleted failed", e);
        }
    }
}
