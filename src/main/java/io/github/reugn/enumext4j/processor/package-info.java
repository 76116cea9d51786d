/**
 * Annotation processor implementation for enumext4j.
 * <p>
 * This package contains the compile-time processor that generates extension classes for enums
 * annotated with {@link io.github.reugn.enumext4j.annotation.EnumExtensions}.
 * <p>
 * <b>Internal implementation</b> - not part of the public API.
 *
 * <p><b>Architecture:</b>
 * <pre>
 * EnumExtensionsProcessor (entry point, one pass per round)
 *     └── ExtensionPipeline
 *           ├── CandidateFilter    - syntax-only enum selection
 *           ├── SemanticResolver   - opt-in marker confirmation
 *           ├── MetadataExtractor  - EnumToGenerate extraction (MarkerSettings fold)
 *           ├── ValidationUtils    - configuration checks
 *           ├── DescriptionCache   - cross-pass reuse of unchanged output
 *           └── ExtensionClassGenerator - JavaPoet rendering
 * </pre>
 *
 * @see io.github.reugn.enumext4j.annotation
 */
package io.github.reugn.enumext4j.processor;
