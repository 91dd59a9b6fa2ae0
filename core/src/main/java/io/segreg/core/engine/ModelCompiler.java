package io.segreg.core.engine;

import io.segreg.core.config.CompilerOptions;
import io.segreg.core.error.ModelCompileException;
import io.segreg.core.model.Constraint;
import io.segreg.core.model.FamilyLink;
import io.segreg.core.model.ModelDefinition;
import io.segreg.core.model.ModelPlan;
import io.segreg.core.model.ParameterTable;
import io.segreg.core.model.PriorTable;
import io.segreg.core.model.Segment;
import io.segreg.core.spec.FormulaParser;
import io.segreg.core.spec.ModelDefinitionParser;
import io.segreg.core.spi.CompilationListener;
import io.segreg.core.spi.SamplerDialect;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles model definitions into {@link CompiledModel}s.
 *
 * <p>
 * The pipeline is: parse formulas, resolve the family and predictor, build the parameter
 * table, derive constraints, synthesize priors, plan the model body, render it through the
 * configured {@link SamplerDialect}, and bind a {@link Simulator}. Any failure aborts the
 * whole compilation; there is no partial output.
 *
 * <p>
 * Stateless apart from its configuration, and thread-safe.
 */
public final class ModelCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(ModelCompiler.class);

    private final DialectRegistry dialects;
    private final CompilerOptions options;
    private final CompilationListener listener;
    private final ModelDefinitionParser definitionParser = new ModelDefinitionParser();

    /** A compiler with the bundled dialects and default options. */
    public ModelCompiler() {
        this(DialectRegistry.withDefaults(), CompilerOptions.DEFAULT, null);
    }

    /** A compiler with the bundled dialects. */
    public ModelCompiler(CompilerOptions options) {
        this(DialectRegistry.withDefaults(), options, null);
    }

    /**
     * Creates a compiler with all collaborators.
     *
     * @param dialects registry resolving {@link CompilerOptions#dialect()}
     * @param options  compiler options
     * @param listener optional listener for compile events, may be null
     * @throws IllegalArgumentException if the configured dialect is not registered
     */
    public ModelCompiler(DialectRegistry dialects, CompilerOptions options, CompilationListener listener) {
        this.dialects = Objects.requireNonNull(dialects, "dialects must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.listener = listener; // nullable
        dialects.requireDialect(options.dialect());
    }

    /** Compiles a gaussian model from segment formulas, with id {@code model}. */
    public CompiledModel compile(List<String> segments) {
        return compile(ModelDefinition.of("model", segments));
    }

    /**
     * Loads a YAML model definition and compiles it.
     *
     * @throws io.segreg.core.error.ModelDefinitionException if the file is invalid
     * @throws ModelCompileException                         if the model does not compile
     */
    public CompiledModel compile(Path definitionFile) {
        ModelDefinition definition;
        try {
            definition = definitionParser.parse(definitionFile);
        } catch (ModelCompileException e) {
            rejected(e.modelId(), e);
            throw e;
        }
        return compile(definition);
    }

    /**
     * Compiles a model definition.
     *
     * @param definition the model
     * @return the compiled model
     * @throws ModelCompileException if any stage rejects the model
     */
    public CompiledModel compile(ModelDefinition definition) {
        Objects.requireNonNull(definition, "definition must not be null");
        String modelId = definition.id();
        long start = System.nanoTime();
        try {
            FamilyLink familyLink = FamilyLink.of(definition.family(), definition.link(), modelId);
            FormulaParser formulaParser = new FormulaParser(modelId);
            List<Segment> segments = formulaParser.parseAll(definition.segments());
            String predictor = formulaParser.resolvePredictor(segments, definition.predictor());

            ParameterTable table = new ParameterTableBuilder(modelId).build(segments, familyLink, predictor);
            List<Constraint> constraints = ConstraintDeriver.derive(table);
            PriorTable priors = new PriorSynthesizer(modelId)
                    .synthesize(table, constraints, familyLink, definition.priors());
            ModelPlan plan = ModelPlanner.plan(modelId, segments, table, familyLink, predictor);

            SamplerDialect dialect = dialects.requireDialect(options.dialect());
            String code = dialect.renderModel(plan, priors, options.segmentComments());
            Simulator simulator = new Simulator(plan, priors, options.simulationSeed());
            CompiledModel model =
                    new CompiledModel(modelId, familyLink, table, constraints, priors, plan, code, simulator);

            long durationMs = (System.nanoTime() - start) / 1_000_000;
            LOG.info(
                    "model.compiled model_id={} family={} segments={} parameters={} dialect={} duration_ms={}",
                    modelId,
                    familyLink,
                    segments.size(),
                    table.names().size(),
                    dialect.id(),
                    durationMs);
            notifyCompiled(model, segments.size(), durationMs);
            return model;
        } catch (ModelCompileException e) {
            rejected(modelId, e);
            throw e;
        }
    }

    public CompilerOptions options() {
        return options;
    }

    private void rejected(String modelId, ModelCompileException e) {
        LOG.warn(
                "model.rejected model_id={} error={} segment={} detail={}",
                modelId,
                e.getClass().getSimpleName(),
                e.segment(),
                e.getMessage());
        notifyRejected(modelId, e);
    }

    // --- Listener notification helpers ---
    // Listener exceptions are caught and logged; they must not affect compilation.

    private void notifyCompiled(CompiledModel model, int segments, long durationMs) {
        if (listener == null) return;
        try {
            listener.onModelCompiled(new CompilationListener.ModelCompiledEvent(
                    model.modelId(), model.familyLink().toString(), segments, model.parameterNames().size(), durationMs));
        } catch (Exception e) {
            LOG.warn("CompilationListener.onModelCompiled failed", e);
        }
    }

    private void notifyRejected(String modelId, ModelCompileException cause) {
        if (listener == null) return;
        try {
            listener.onModelRejected(new CompilationListener.ModelRejectedEvent(
                    modelId, cause.getClass().getSimpleName(), cause.getMessage()));
        } catch (Exception e) {
            LOG.warn("CompilationListener.onModelRejected failed", e);
        }
    }
}
