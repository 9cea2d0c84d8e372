package com.largomodo.loadplanner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.largomodo.loadplanner.core.ArmRange;
import com.largomodo.loadplanner.core.ContainerWidthResolver;
import com.largomodo.loadplanner.core.LoadPlan;
import com.largomodo.loadplanner.core.LoadPlanProcessor;
import com.largomodo.loadplanner.core.PlacementObserver;
import com.largomodo.loadplanner.core.SlotModelBuilder;
import com.largomodo.loadplanner.core.StrategyType;
import com.largomodo.loadplanner.core.domain.Aircraft;
import com.largomodo.loadplanner.core.domain.Container;
import com.largomodo.loadplanner.core.domain.ContainerTypeEntry;
import com.largomodo.loadplanner.core.domain.DeckGeometry;
import com.largomodo.loadplanner.core.domain.SlotRun;
import com.largomodo.loadplanner.service.AircraftCatalogReader;
import com.largomodo.loadplanner.service.AnsiPalette;
import com.largomodo.loadplanner.service.ConsolePrompter;
import com.largomodo.loadplanner.service.ContainerListReader;
import com.largomodo.loadplanner.service.ContainerTypeCatalogReader;
import com.largomodo.loadplanner.service.JsonCatalogReader;
import com.largomodo.loadplanner.service.LoadPlanRenderer;
import com.largomodo.loadplanner.service.LoadPlanWriter;
import com.largomodo.loadplanner.service.ReadResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.*;
import picocli.CommandLine.Model.CommandSpec;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.SortedMap;
import java.util.concurrent.Callable;

/**
 * CLI entry point for ULD load planning.
 * <p>
 * Uses Picocli for argument parsing with automatic help generation. Reference
 * catalogs come from the bundled classpath copies unless {@code --aircraft-db} /
 * {@code --uld-db} point at files. Containers are read from a batch file with
 * {@code --containers}, otherwise prompted for interactively.
 * <p>
 * Output: the assignment table and bay diagram go to standard output; the
 * diagram is also saved to {@code loadplan.txt} (or {@code -o}). A catalog that
 * cannot be loaded or a plan file that cannot be written is a warning, never a
 * failed run.
 */
@Command(
        name = "loadplanner",
        mixinStandardHelpOptions = true,
        resourceBundle = "loadplanner.loadplanner",
        version = "${bundle:application.version}",
        header = "Suggests a placement of ULD containers onto aircraft cargo slots.",
        description = {
                "Places each container, in the order given, onto the first free run of cargo slots" +
                        " that satisfies its deck restriction, nose/tail permission and slot width" +
                        " (or, with --strategy CG_BALANCE, onto the run keeping the load centered).",
                "",
                "Containers that do not fit are reported as UNASSIGNED. This is a planning aid, not a" +
                        " certified weight-and-balance tool."
        },
        exitCodeListHeading = "%nExit Codes:%n",
        exitCodeList = {
                "0:Successful completion",
                "1:General execution error (I/O, input ended, etc.)",
                "2:Invalid command line arguments"
        },
        footerHeading = "%nContainer file format:%n",
        footer = {
                "  id,weight[,MAIN|LOWER|ANY[,y|n]]   one container per line, # starts a comment",
                "",
                "Project home: ${bundle:application.url}"
        }
)
public class LoadPlanner implements Callable<Integer> {

    static final String DEFAULT_OUTPUT = "loadplan.txt";

    private static final Logger log = LoggerFactory.getLogger(LoadPlanner.class);

    @Option(names = {"-m", "--model"}, paramLabel = "MODEL",
            description = {
                    "Aircraft model from the aircraft catalog.",
                    "If omitted, the known models are listed and the model is prompted for.",
                    "An unknown model is planned as a custom aircraft (see --main-slots, --lower-slots)."
            })
    String model;

    @Option(names = "--aircraft-db", paramLabel = "FILE",
            description = "Aircraft catalog JSON file (default: bundled catalog).")
    File aircraftDb;

    @Option(names = "--uld-db", paramLabel = "FILE",
            description = "Container-type catalog JSON file (default: bundled catalog).")
    File uldDb;

    @Option(names = {"-c", "--containers"}, paramLabel = "FILE",
            description = "Batch container list. If omitted, containers are entered interactively.")
    File containersFile;

    @Option(names = {"-o", "--output"}, paramLabel = "FILE", defaultValue = DEFAULT_OUTPUT,
            description = "File the bay diagram is saved to. Default: ${DEFAULT-VALUE}")
    File outputFile;

    @Option(names = "--strategy", defaultValue = "FIRST_FIT",
            description = {
                    "Placement strategy for the whole run.",
                    "Valid values: ${COMPLETION-CANDIDATES}",
                    "Default: ${DEFAULT-VALUE}"
            })
    StrategyType strategy;

    @Option(names = "--main-arms", paramLabel = "FORE,AFT", defaultValue = "18,36",
            converter = ArmRangeConverter.class,
            description = "Fore and aft arm used when the main deck has no slot arms. Default: ${DEFAULT-VALUE}")
    ArmRange mainArms;

    @Option(names = "--lower-arms", paramLabel = "FORE,AFT", defaultValue = "12,28",
            converter = ArmRangeConverter.class,
            description = "Fore and aft arm used when the lower deck has no slot arms. Default: ${DEFAULT-VALUE}")
    ArmRange lowerArms;

    @Option(names = "--main-slots", paramLabel = "N",
            description = "Main deck slot count of a custom aircraft (prompted if needed and omitted).")
    Integer mainSlots;

    @Option(names = "--lower-slots", paramLabel = "N",
            description = "Lower deck slot count of a custom aircraft (prompted if needed and omitted).")
    Integer lowerSlots;

    @Option(names = "--color", description = "Colour occupied cells by container type on the console.")
    boolean color;

    @Option(names = "--list-aircraft", description = "List the catalog's aircraft models and exit.")
    boolean listAircraft;

    @Spec
    CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose;

    private final BufferedReader in;
    private final PrintStream out;

    public LoadPlanner() {
        this(System.in, System.out);
    }

    /**
     * @param in  source of interactive answers
     * @param out destination of prompts and reports
     */
    public LoadPlanner(InputStream in, PrintStream out) {
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
    }

    public static void main(String[] args) {
        CommandLine cmd = new CommandLine(new LoadPlanner());
        cmd.setCaseInsensitiveEnumValuesAllowed(true);
        int exitCode = cmd.execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        if (verbose) {
            ch.qos.logback.classic.Logger root =
                    (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
            root.setLevel(ch.qos.logback.classic.Level.DEBUG);
        }

        if (containersFile != null && !containersFile.isFile()) {
            throw new ParameterException(spec.commandLine(),
                    "Container file does not exist: " + containersFile.getAbsolutePath());
        }
        if ((mainSlots != null && mainSlots < 0) || (lowerSlots != null && lowerSlots < 0)) {
            throw new ParameterException(spec.commandLine(), "Slot counts must not be negative");
        }
        if (outputFile.isDirectory()) {
            throw new ParameterException(spec.commandLine(),
                    "Output path must be a file, not a directory: " + outputFile.getAbsolutePath());
        }

        ObjectMapper objectMapper = new ObjectMapper();
        SortedMap<String, Aircraft> aircraftCatalog = loadCatalog(
                new AircraftCatalogReader(objectMapper), aircraftDb, AircraftCatalogReader.BUNDLED_RESOURCE);
        List<ContainerTypeEntry> containerTypes = loadCatalog(
                new ContainerTypeCatalogReader(objectMapper), uldDb, ContainerTypeCatalogReader.BUNDLED_RESOURCE);

        if (listAircraft) {
            printAircraft(aircraftCatalog);
            return 0;
        }

        ConsolePrompter prompter = new ConsolePrompter(in, out);
        Aircraft aircraft = resolveAircraft(aircraftCatalog, prompter);
        List<Container> containers = readContainers(prompter);

        ContainerWidthResolver widthResolver = new ContainerWidthResolver(containerTypes);
        LoadPlanProcessor processor = new LoadPlanProcessor(
                new SlotModelBuilder(mainArms, lowerArms), widthResolver, strategy, new PlacementObserver() {
                    @Override
                    public void onPlaced(Container container, SlotRun run) {
                        log.debug("{} -> {}", container.id(), run.slots().get(0).label());
                    }

                    @Override
                    public void onUnassigned(Container container, int width) {
                        log.info("No room for {} ({} slot(s) wide), leaving it unassigned", container.id(), width);
                    }
                });

        LoadPlan plan;
        MDC.put("aircraft", aircraft.model());
        try {
            plan = processor.plan(aircraft, containers);
        } finally {
            MDC.remove("aircraft");
        }

        LoadPlanRenderer renderer = new LoadPlanRenderer(widthResolver);
        renderer.renderAssignments(aircraft, plan).forEach(out::println);
        renderer.renderDiagram(aircraft, plan, color ? AnsiPalette.defaults() : AnsiPalette.NONE)
                .forEach(out::println);

        savePlan(renderer.renderDiagram(aircraft, plan, AnsiPalette.NONE));
        out.println();
        out.println("Done.");
        out.flush();
        return 0;
    }

    private static <T> T loadCatalog(JsonCatalogReader<T> reader, File file, String bundledResource) {
        ReadResult<T> result = file != null ? reader.read(file.toPath()) : reader.readResource(bundledResource);
        result.warnings().forEach(warning -> log.warn("{}", warning));
        return result.value();
    }

    private void printAircraft(SortedMap<String, Aircraft> catalog) {
        if (catalog.isEmpty()) {
            out.println("Aircraft catalog is empty.");
            return;
        }
        out.println("Aircraft in DB:");
        for (Aircraft aircraft : catalog.values()) {
            out.println(" - " + aircraft.model() + " (main " + aircraft.mainDeck().slotCount() +
                    ", lower " + aircraft.lowerDeck().slotCount() + " slots, MTOW " +
                    aircraft.maxTakeoffWeight() + " kg)");
        }
    }

    /**
     * Catalog entry for the chosen model, or a custom aircraft with plain decks
     * (no nose/tail zones, interpolated arms) when the model is blank or unknown.
     */
    Aircraft resolveAircraft(SortedMap<String, Aircraft> catalog, ConsolePrompter prompter) throws IOException {
        String chosen = model;
        if (chosen == null) {
            if (!catalog.isEmpty()) {
                out.println("Aircraft in DB:");
                catalog.keySet().forEach(name -> out.println(" - " + name));
            }
            chosen = prompter.promptLine("Enter aircraft model: ");
        }
        chosen = chosen.trim();

        if (!chosen.isEmpty() && catalog.containsKey(chosen)) {
            log.info("Using DB entry for {}", chosen);
            return catalog.get(chosen);
        }

        if (chosen.isEmpty()) {
            log.info("Custom aircraft");
        } else {
            log.warn("Aircraft model {} not in catalog, planning a custom aircraft", chosen);
        }
        int main = mainSlots != null ? mainSlots : prompter.promptCount("Main deck slots: ");
        int lower = lowerSlots != null ? lowerSlots : prompter.promptCount("Lower deck slots: ");
        return new Aircraft(chosen.isEmpty() ? "CUSTOM" : chosen,
                DeckGeometry.ofSlots(main), DeckGeometry.ofSlots(lower), 0);
    }

    private List<Container> readContainers(ConsolePrompter prompter) throws IOException {
        if (containersFile == null) {
            return prompter.promptContainers();
        }
        ReadResult<List<Container>> result = new ContainerListReader().read(containersFile.toPath());
        result.warnings().forEach(warning -> log.warn("{}", warning));
        log.info("Read {} ULD(s) from {}", result.value().size(), containersFile.getName());
        return result.value();
    }

    /**
     * Saves the plain diagram. Failure is reported and swallowed: the plan on
     * screen stays valid whether or not the file could be written.
     */
    private void savePlan(List<String> lines) {
        try {
            new LoadPlanWriter().write(outputFile.toPath(), lines);
            log.info("Load plan saved to {}", outputFile);
        } catch (IOException e) {
            log.warn("Failed to save load plan to {}: {}", outputFile, e.getMessage());
        }
    }

    /**
     * Picocli converter for {@code FORE,AFT} arm pairs.
     */
    static class ArmRangeConverter implements ITypeConverter<ArmRange> {
        @Override
        public ArmRange convert(String value) {
            try {
                return ArmRange.parse(value);
            } catch (IllegalArgumentException e) {
                throw new TypeConversionException(e.getMessage());
            }
        }
    }
}
