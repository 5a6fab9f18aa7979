package work.semiocore.kernel.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.semiocore.kernel.engine.ExecutionEngine;
import work.semiocore.kernel.engine.Trace;
import work.semiocore.kernel.json.TraceReader;
import work.semiocore.kernel.model.Program;
import work.semiocore.kernel.model.World;
import work.semiocore.kernel.parser.ProgramParser;
import work.semiocore.kernel.parser.StrictChecker;
import work.semiocore.kernel.plasticity.PlasticityAnalyzer;
import work.semiocore.kernel.plasticity.PlasticityReport;
import work.semiocore.kernel.plasticity.PlasticityRequest;
import work.semiocore.kernel.plasticity.TraceEvidence;
import work.semiocore.kernel.scan.ContextScanner;
import work.semiocore.kernel.scan.CtxScanReport;
import work.semiocore.kernel.scan.ScanOptions;
import work.semiocore.kernel.shared.Digests;
import work.semiocore.kernel.world.WorldLoader;

/**
 * File-level entry point shared by the CLI and embedding applications. Paths are recorded in the
 * outputs exactly as given so fixtures stay portable.
 */
public final class SemioToolchain {
    private static final Logger LOG = LoggerFactory.getLogger(SemioToolchain.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    public Program check(Path programPath, boolean strict) {
        Program program = ProgramParser.parseFile(programPath);
        if (strict) {
            StrictChecker.check(program, programPath.toString());
        }
        return program;
    }

    public Trace run(Path programPath, Path worldPath) {
        Program program = ProgramParser.parseFile(programPath);
        World world = WorldLoader.load(worldPath);
        return ExecutionEngine.run(program, world, programPath.toString());
    }

    public RunManifest manifest(Path programPath, Path worldPath) throws IOException {
        Program program = ProgramParser.parseFile(programPath);
        return new RunManifest(
            programPath.toString(),
            Digests.sha256Hex(programPath),
            worldPath.toString(),
            Digests.sha256Hex(worldPath),
            program.seed()
        );
    }

    /**
     * Re-runs the program recorded in a manifest, applying its seed. Program and world paths are
     * taken as given when they exist, else relative to the manifest's directory. Older manifests
     * name the world under {@code world}.
     */
    public Trace replay(Path manifestPath) {
        JsonNode manifest;
        try {
            manifest = JSON.readTree(Files.readString(manifestPath));
        } catch (IOException ex) {
            throw new ManifestException("Failed to read manifest: " + manifestPath, ex);
        }
        if (manifest == null || !manifest.isObject()) {
            throw new ManifestException("Manifest must be a JSON object: " + manifestPath);
        }
        String schema = manifest.path("schema").asText(null);
        if (!RunManifest.SCHEMA.equals(schema)) {
            throw new ManifestException("Unsupported manifest schema: " + schema);
        }
        String programFile = manifest.path("program_file").asText("");
        String worldFile = manifest.path("world_file").asText("");
        if (worldFile.isBlank()) {
            worldFile = manifest.path("world").asText("");
        }
        if (programFile.isBlank() || worldFile.isBlank()) {
            throw new ManifestException("Manifest must contain 'program_file' and 'world_file' (or 'world').");
        }

        Path baseDir = manifestPath.toAbsolutePath().getParent();
        Program program = ProgramParser.parseFile(resolveAgainst(programFile, baseDir));
        if (manifest.hasNonNull("seed")) {
            program = program.withSeed(manifest.get("seed").asLong());
        }
        World world = WorldLoader.load(resolveAgainst(worldFile, baseDir));
        LOG.debug("Replaying {} with seed {}", programFile, program.seed().orElse(null));
        return ExecutionEngine.run(program, world, programFile);
    }

    public CtxScanReport ctxscan(Path programPath, Path worldPath, ScanOptions.Builder options) {
        Program program = ProgramParser.parseFile(programPath);
        World world = WorldLoader.load(worldPath);
        ScanOptions resolved = options
            .programFile(programPath.toString())
            .worldFile(worldPath.toString())
            .build();
        return ContextScanner.scan(program, world, resolved);
    }

    public PlasticityReport plasticity(List<Path> tracePaths, PlasticityRequest request) throws IOException {
        var evidence = new ArrayList<TraceEvidence>(tracePaths.size());
        for (Path path : tracePaths) {
            evidence.add(TraceReader.read(path));
        }
        return PlasticityAnalyzer.analyze(evidence, request);
    }

    static Path resolveAgainst(String raw, Path baseDir) {
        Path given = Path.of(raw);
        if (Files.exists(given)) {
            return given;
        }
        return Optional.ofNullable(baseDir)
            .map(dir -> dir.resolve(raw).normalize())
            .filter(Files::exists)
            .orElse(given);
    }
}
