package guraa.wiringdoc.cli;

import guraa.wiringdoc.WiringDocApplication;
import guraa.wiringdoc.config.AppProperties;
import guraa.wiringdoc.config.PackConfiguration;
import guraa.wiringdoc.config.PackConfigurationLoader;
import guraa.wiringdoc.exception.AssemblyException;
import guraa.wiringdoc.exception.PackBuildException;
import guraa.wiringdoc.model.BlockSummary;
import guraa.wiringdoc.service.PackBuildRequest;
import guraa.wiringdoc.service.PackBuildResult;
import guraa.wiringdoc.service.PackBuildService;
import guraa.wiringdoc.service.PackRequestFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Set;

/**
 * Command line entry point.
 *
 * <pre>
 * build &lt;config.yaml&gt; [output.pdf] [--set-timestamp=&lt;ISO-8601&gt;] [--debug-retain-working-directory]
 * check &lt;config.yaml&gt;
 * </pre>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PackCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    static final String OPTION_TIMESTAMP = "set-timestamp";
    static final String OPTION_RETAIN = "debug-retain-working-directory";

    private static final Set<String> OPTIONS = Set.of(OPTION_TIMESTAMP, OPTION_RETAIN);

    private final PackConfigurationLoader configurationLoader;
    private final PackRequestFactory requestFactory;
    private final PackBuildService buildService;
    private final AppProperties appProperties;

    private int exitCode = EXIT_OK;

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Run a command.
     *
     * @param args The parsed command line
     * @return The process exit code
     */
    int execute(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        if (positional.isEmpty()) {
            logUsage();
            return EXIT_USAGE;
        }

        try {
            checkOptions(args);
            switch (positional.get(0)) {
                case "build":
                    return build(positional, args);
                case "check":
                    return check(positional, args);
                default:
                    throw new UsageException("unknown command '" + positional.get(0) + "'");
            }
        } catch (UsageException e) {
            log.error("Invalid arguments: {}", e.getMessage());
            logUsage();
            return EXIT_USAGE;
        } catch (PackBuildException e) {
            log.error("{}", e.getMessage(), e);
            return EXIT_FAILED;
        } catch (RuntimeException e) {
            log.error("Unexpected error while running '{}': {}", positional.get(0), e.getMessage(), e);
            return EXIT_FAILED;
        }
    }

    private int build(List<String> positional, ApplicationArguments args) {
        if (positional.size() < 2 || positional.size() > 3) {
            throw new UsageException("build takes a configuration file and an optional output file");
        }
        Clock clock = parseClock(args);
        PackConfiguration configuration = configurationLoader.load(Path.of(positional.get(1)));

        Path output = positional.size() == 3
                ? Path.of(positional.get(2)).toAbsolutePath().normalize()
                : defaultOutput(configuration);
        Path retainDirectory = args.containsOption(OPTION_RETAIN) ? retainDirectory(configuration) : null;

        PackBuildRequest request = requestFactory.create(configuration, output, clock, retainDirectory);
        PackBuildResult result = buildService.buildPack(request);

        for (BlockSummary block : result.getBlocks()) {
            log.info("  {}: pages {}-{} ({} data, {} plan)", block.getRoom(), block.getFirstPage(),
                    block.getFirstPage() + block.getPageCount() - 1, block.getDataPages(), block.getPlanPages());
        }
        log.info("Wrote {} ({} pages) in {}", result.getOutput(), result.getPageCount(),
                WiringDocApplication.formatDuration(result.getElapsed()));
        return EXIT_OK;
    }

    private int check(List<String> positional, ApplicationArguments args) {
        if (positional.size() != 2) {
            throw new UsageException("check takes exactly one configuration file");
        }
        if (args.containsOption(OPTION_TIMESTAMP) || args.containsOption(OPTION_RETAIN)) {
            throw new UsageException("check takes no options");
        }
        PackConfiguration configuration = configurationLoader.load(Path.of(positional.get(1)));
        PackBuildRequest request = requestFactory.create(configuration, defaultOutput(configuration),
                Clock.systemUTC(), null);
        buildService.check(request);
        log.info("{} is valid", configuration.getConfigFile());
        return EXIT_OK;
    }

    private static void checkOptions(ApplicationArguments args) {
        for (String name : args.getOptionNames()) {
            // Spring properties such as --logging.level.root=DEBUG pass through
            if (!OPTIONS.contains(name) && !name.contains(".")) {
                throw new UsageException("unknown option --" + name);
            }
        }
    }

    /**
     * Get the clock the build stamps its output with: fixed when a timestamp is given, the system clock otherwise.
     *
     * @throws UsageException If the timestamp option is repeated, empty or not ISO-8601
     */
    static Clock parseClock(ApplicationArguments args) {
        if (!args.containsOption(OPTION_TIMESTAMP)) {
            return Clock.systemUTC();
        }
        List<String> values = args.getOptionValues(OPTION_TIMESTAMP);
        if (values == null || values.size() != 1 || values.get(0).isBlank()) {
            throw new UsageException("--" + OPTION_TIMESTAMP + " takes exactly one value");
        }
        try {
            // Accepts "Z" as well as numeric offsets
            return Clock.fixed(Instant.parse(values.get(0).trim()), ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new UsageException("--" + OPTION_TIMESTAMP + " is not an ISO-8601 date-time with offset: "
                    + values.get(0));
        }
    }

    private static Path defaultOutput(PackConfiguration configuration) {
        Path configFile = configuration.getConfigFile();
        return configFile.resolveSibling(FilenameUtils.getBaseName(configFile.toString()) + ".pdf");
    }

    private Path retainDirectory(PackConfiguration configuration) {
        Path configured = configuration.getOutput() == null
                ? null
                : configuration.resolve(configuration.getOutput().getWorkingDirectory());
        try {
            if (configured == null) {
                return Files.createTempDirectory(appProperties.getPack().getWorkingDirectoryPrefix());
            }
            FileUtils.forceMkdir(configured.toFile());
            return configured;
        } catch (IOException e) {
            throw AssemblyException.of("cannot create working directory: " + e.getMessage(), e);
        }
    }

    private static void logUsage() {
        log.info("Usage:");
        log.info("  build <config.yaml> [output.pdf] [--{}=<ISO-8601>] [--{}]", OPTION_TIMESTAMP, OPTION_RETAIN);
        log.info("  check <config.yaml>");
    }
}
