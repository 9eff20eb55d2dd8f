package com.ldap.searchfilter;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.zip.GZIPInputStream;
import java.util.zip.ZipInputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ldap.searchfilter.config.DeobfuscationConfig;
import com.ldap.searchfilter.parser.FilterParseException;
import com.ldap.searchfilter.parser.SearchFilterConverter;
import com.ldap.searchfilter.parser.SearchFilterFormat;
import com.ldap.searchfilter.service.TokenValidationException;
import com.ldap.searchfilter.transform.DeobfuscationPipeline;
import com.ldap.searchfilter.transform.DeobfuscationResult;
import com.ldap.searchfilter.transform.TransformType;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Command line front end: deobfuscates SearchFilters given as arguments, read from files (one per
 * line, plain, gzip or zip) or from stdin.
 */
@Command(name = "searchFilterDeobfuscator", mixinStandardHelpOptions = true, version = "1.0",
         description = "Parses LDAP SearchFilters and applies semantics-preserving deobfuscation transforms")
public class SearchFilterDeobfuscator implements Callable<Integer> {

    private static Logger logger = LoggerFactory.getLogger(SearchFilterDeobfuscator.class);

    @Option(names = { "-f", "--filter" }, description = "SearchFilter(s) to deobfuscate")
    private List<String> filters;

    @Option(names = { "-i", "--input" }, description = "Files with one SearchFilter per line (if neither -f nor -i is given, reads from stdin)")
    private List<String> files;

    @Option(names = { "-t", "--transform" }, split = ",", description = "Transforms to run, in order (default: all, from config)")
    private List<String> transforms;

    @Option(names = "--percent", description = "RandomNodePercent 0-100 (default: 50)")
    private Integer percent;

    @Option(names = "--char-percent", description = "RandomCharPercent 0-100 (default: 50)")
    private Integer charPercent;

    @Option(names = "--seed", description = "Seed for the random source")
    private Long seed;

    @Option(names = "--track", description = "Tag modified tokens in the output")
    private boolean track = false;

    @Option(names = "--config", description = "Properties file for deobfuscation configuration")
    private String configFile;

    @Option(names = "--format", description = "Output representation: ${COMPLETION-CANDIDATES} (default: STRING)")
    private SearchFilterFormat format = SearchFilterFormat.STRING;

    @Option(names = "--stats", description = "Print a length-reduction summary")
    private boolean stats = false;

    private final PrintStream out;
    private DeobfuscationPipeline pipeline;
    private DeobfuscationStats deobfuscationStats;
    private int failures = 0;

    public SearchFilterDeobfuscator() {
        this(System.out);
    }

    public SearchFilterDeobfuscator(PrintStream out) {
        this.out = out;
    }

    @Override
    public Integer call() throws Exception {
        pipeline = buildConfig().toPipeline();
        deobfuscationStats = new DeobfuscationStats();
        long start = System.currentTimeMillis();

        if (filters != null && !filters.isEmpty()) {
            for (String filter : filters) {
                process(filter);
            }
        }
        if (files != null && !files.isEmpty()) {
            for (String fileName : files) {
                read(new File(fileName));
            }
        }
        if ((filters == null || filters.isEmpty()) && (files == null || files.isEmpty())) {
            read(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
        }

        long dur = System.currentTimeMillis() - start;
        logger.info("Processed {} SearchFilter(s) in {}ms, {} failed", deobfuscationStats.getCount() + failures, dur,
                failures);
        if (stats) {
            deobfuscationStats.report(out);
        }
        return failures > 0 ? 1 : 0;
    }

    DeobfuscationConfig buildConfig() {
        DeobfuscationConfig config = new DeobfuscationConfig();
        if (configFile != null) {
            config.loadFromFile(configFile);
        }
        if (percent != null) {
            config.setRandomNodePercent(percent);
        }
        if (charPercent != null) {
            config.setRandomCharPercent(charPercent);
        }
        if (seed != null) {
            config.setSeed(seed);
        }
        if (track) {
            config.setTrackModification(true);
        }
        if (transforms != null && !transforms.isEmpty()) {
            List<TransformType> order = new ArrayList<>();
            for (String name : transforms) {
                TransformType type = TransformType.findByName(name);
                if (type == null) {
                    throw new CommandLine.ParameterException(new CommandLine(this), "Unknown transform: " + name);
                }
                order.add(type);
            }
            config.setOrder(order);
        }
        return config;
    }

    public void read(File file) throws IOException {
        try (BufferedReader in = createReader(file)) {
            read(in);
        }
        logger.info("Processed file: {}", file.getName());
    }

    private void read(BufferedReader in) throws IOException {
        String line;
        while ((line = in.readLine()) != null) {
            if (!line.trim().isEmpty()) {
                process(line);
            }
        }
    }

    private void process(String filter) {
        try {
            DeobfuscationResult result = pipeline.run(filter);
            deobfuscationStats.add(result);
            if (format == SearchFilterFormat.STRING) {
                out.println(result.getOutputString());
            } else {
                out.println(JsonTreeWriter.toJsonString(SearchFilterConverter.convert(result.getOutput(), format)));
            }
        } catch (FilterParseException | TokenValidationException e) {
            failures++;
            deobfuscationStats.addFailure();
            logger.warn("Could not deobfuscate SearchFilter '{}': {}", filter, e.getMessage());
        }
    }

    private BufferedReader createReader(File file) throws IOException {
        String name = file.getName().toLowerCase();
        if (name.endsWith(".gz")) {
            FileInputStream fis = new FileInputStream(file);
            GZIPInputStream gzis = new GZIPInputStream(fis);
            return new BufferedReader(new InputStreamReader(gzis, StandardCharsets.UTF_8));
        } else if (name.endsWith(".zip")) {
            FileInputStream fis = new FileInputStream(file);
            ZipInputStream zis = new ZipInputStream(fis);
            if (zis.getNextEntry() == null) {
                zis.close();
                throw new IOException("Empty zip file: " + file);
            }
            return new BufferedReader(new InputStreamReader(zis, StandardCharsets.UTF_8));
        } else {
            return new BufferedReader(new FileReader(file, StandardCharsets.UTF_8));
        }
    }

    public int getFailures() {
        return failures;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new SearchFilterDeobfuscator()).execute(args);
        System.exit(exitCode);
    }
}
