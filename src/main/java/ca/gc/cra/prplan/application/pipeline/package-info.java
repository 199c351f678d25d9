/**
 * Application-level pipelines that plan both account classes and build the PR report.
 * <p>{@link ca.gc.cra.prplan.application.pipeline.PlanGenerationUseCase} sequences validation, discovery and
 * planning; {@link ca.gc.cra.prplan.application.pipeline.ReportGenerationUseCase} works from stored artifacts only
 * and can be re-run on its own.</p>
 * <p>Group workers follow the {@code prplan-group-*} naming convention and carry the {@code group} MDC key.</p>
 */
package ca.gc.cra.prplan.application.pipeline;
