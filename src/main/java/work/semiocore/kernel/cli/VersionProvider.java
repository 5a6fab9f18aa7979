package work.semiocore.kernel.cli;

import picocli.CommandLine;
import work.semiocore.kernel.api.RunManifest;
import work.semiocore.kernel.engine.Trace;
import work.semiocore.kernel.json.ProgramAst;

/**
 * {@code --version}: toolchain build plus the language and document versions it reads and writes.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    static final String DEVELOPMENT_BUILD = "development";

    @Override
    public String[] getVersion() {
        String build = Main.class.getPackage().getImplementationVersion();
        return new String[] {
            "semioc " + (build == null ? DEVELOPMENT_BUILD : build),
            "language " + ProgramAst.LANG_VERSION + " (semio " + RunManifest.SEMIO_VERSION
                + ", stdlib " + RunManifest.STDLIB_VERSION + ")",
            "documents " + String.join(", ", Trace.SCHEMA, RunManifest.SCHEMA, ProgramAst.SCHEMA)
        };
    }
}
