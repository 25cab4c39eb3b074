package eu.fbk.ontomodule.internal;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.net.URL;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.base.Joiner;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import org.apache.commons.cli.GnuParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;

import ch.qos.logback.classic.Level;

/**
 * The parsed command line of a tool.
 * <p>
 * Instances are obtained from a {@link Parser}, which wraps commons-cli adding mandatory options,
 * value validation and the standard {@code --help}, {@code --version} and {@code --verbose}
 * options. Values of repeated options accumulate in command line order and can be retrieved
 * either by option letter or by long name. Problems with the command line are reported as
 * {@link Exception}s, which {@link #fail(Throwable)} turns into a syntax error exit code.
 * </p>
 */
public final class CommandLine {

    private static final String VERSION_RESOURCE = //
    "META-INF/maven/eu.fbk.ontomodule/om-tool/pom.properties";

    private final Set<String> present;

    private final ListMultimap<String, String> values;

    private CommandLine(final Set<String> present, final ListMultimap<String, String> values) {
        this.present = present;
        this.values = values;
    }

    public boolean hasOption(final String letterOrName) {
        return this.present.contains(letterOrName);
    }

    /**
     * Returns all the values given to an option, converted to the type specified.
     *
     * @param letterOrName
     *            the option letter or long name
     * @param type
     *            either {@code String} or {@code File}
     * @return the values in command line order, empty if the option is missing
     */
    public <T> List<T> getOptionValues(final String letterOrName, final Class<T> type) {
        final List<T> result = Lists.newArrayList();
        for (final String value : this.values.get(letterOrName)) {
            result.add(convert(letterOrName, value, type));
        }
        return result;
    }

    /**
     * Returns the only value of an option.
     *
     * @param letterOrName
     *            the option letter or long name
     * @param type
     *            the type of the value
     * @return the value, or null if the option is missing
     * @throws Exception
     *             if the option was given more than once
     */
    @Nullable
    public <T> T getOptionValue(final String letterOrName, final Class<T> type) {
        final List<String> strings = this.values.get(letterOrName);
        if (strings.isEmpty()) {
            return null;
        } else if (strings.size() > 1) {
            throw new Exception("Option '" + letterOrName + "' accepts one value, got "
                    + Joiner.on(", ").join(strings));
        }
        return convert(letterOrName, strings.get(0), type);
    }

    public <T> T getOptionValue(final String letterOrName, final Class<T> type,
            final T defaultValue) {
        final T value = getOptionValue(letterOrName, type);
        return value != null ? value : defaultValue;
    }

    private static <T> T convert(final String option, final String value, final Class<T> type) {
        if (type == String.class) {
            return type.cast(value);
        } else if (type == File.class) {
            return type.cast(new File(value));
        }
        throw new IllegalArgumentException("Unsupported type " + type.getName()
                + " for option '" + option + "'");
    }

    /**
     * Terminates the JVM after a failure, printing a message on standard error. An
     * {@link Exception} without message terminates with status 0 (e.g., after {@code --help}),
     * other {@code Exception}s with status 2 as syntax errors; any other throwable is an
     * execution failure, terminating with status 1 after printing its stack trace.
     *
     * @param throwable
     *            the failure
     */
    public static void fail(final Throwable throwable) {
        if (throwable instanceof Exception) {
            if (throwable.getMessage() == null) {
                System.exit(0);
            }
            System.err.println("SYNTAX ERROR: " + throwable.getMessage());
            System.exit(2);
        }
        System.err.println("EXECUTION FAILED: " + throwable.getMessage());
        throwable.printStackTrace();
        System.exit(1);
    }

    public static Parser parser() {
        return new Parser();
    }

    /**
     * Builds the options of a tool and parses its arguments.
     */
    public static final class Parser {

        private final Options options;

        private final Map<String, Type> types;

        private final List<String> mandatory;

        private String name;

        @Nullable
        private String header;

        @Nullable
        private String footer;

        @Nullable
        private Logger logger;

        Parser() {
            this.options = new Options();
            this.types = Maps.newHashMap();
            this.mandatory = Lists.newArrayList();
            this.name = "java";
        }

        public Parser withName(final String name) {
            this.name = Preconditions.checkNotNull(name);
            return this;
        }

        public Parser withHeader(@Nullable final String header) {
            this.header = header;
            return this;
        }

        public Parser withFooter(@Nullable final String footer) {
            this.footer = footer;
            return this;
        }

        /**
         * Sets the logger whose level is lowered to DEBUG by the {@code --verbose} option, which
         * is offered only if a logger is set.
         *
         * @param logger
         *            the logger, possibly null
         * @return this parser
         */
        public Parser withLogger(@Nullable final Logger logger) {
            this.logger = logger;
            return this;
        }

        /**
         * Adds a flag, i.e., an option without values.
         *
         * @param letter
         *            the short name, possibly null
         * @param name
         *            the long name
         * @param description
         *            the description shown by {@code --help}
         * @return this parser
         */
        public Parser withOption(@Nullable final String letter, final String name,
                final String description) {
            return add(letter, name, description, null, null, 0, false);
        }

        /**
         * Adds an option taking values. The option may be repeated, in which case its values
         * accumulate.
         *
         * @param letter
         *            the short name, possibly null
         * @param name
         *            the long name
         * @param description
         *            the description shown by {@code --help}
         * @param argName
         *            the name of the values shown by {@code --help}
         * @param type
         *            the type values are validated against
         * @param arity
         *            the number of values following each occurrence of the option
         * @param mandatory
         *            true if the option must be given
         * @return this parser
         */
        public Parser withOption(@Nullable final String letter, final String name,
                final String description, final String argName, final Type type,
                final int arity, final boolean mandatory) {
            Preconditions.checkNotNull(argName);
            Preconditions.checkNotNull(type);
            Preconditions.checkArgument(arity > 0);
            return add(letter, name, description, argName, type, arity, mandatory);
        }

        private Parser add(@Nullable final String letter, final String name,
                final String description, @Nullable final String argName,
                @Nullable final Type type, final int arity, final boolean mandatory) {
            Preconditions.checkArgument(name.length() > 1, "Invalid option name %s", name);
            Preconditions.checkNotNull(description);
            final Option option = new Option(letter, name, arity > 0, description);
            if (arity > 0) {
                option.setArgName(argName);
                option.setArgs(arity);
                this.types.put(name, type);
            }
            this.options.addOption(option);
            if (mandatory) {
                this.mandatory.add(name);
            }
            return this;
        }

        /**
         * Parses the arguments supplied. The {@code --help} and {@code --version} options print
         * the requested information and raise an {@link Exception} with no message.
         *
         * @param args
         *            the command line arguments
         * @return the parsed command line
         * @throws Exception
         *             if the arguments are not valid
         */
        public CommandLine parse(final String... args) {

            final Options options = new Options();
            for (final Object option : this.options.getOptions()) {
                options.addOption((Option) option);
            }
            if (this.logger != null) {
                options.addOption("V", "verbose", false, "enable verbose output");
            }
            options.addOption("v", "version", false, "display version information and terminate");
            options.addOption("h", "help", false, "display this help message and terminate");

            final org.apache.commons.cli.CommandLine cmd;
            try {
                cmd = new GnuParser().parse(options, args);
            } catch (final ParseException ex) {
                printHelp(options);
                throw new Exception(ex.getMessage(), ex);
            }

            if (cmd.hasOption("v")) {
                printVersion();
                throw new Exception(null);
            } else if (cmd.hasOption("h")) {
                printHelp(options);
                throw new Exception(null);
            }

            if (cmd.hasOption("V") && this.logger instanceof ch.qos.logback.classic.Logger) {
                ((ch.qos.logback.classic.Logger) this.logger).setLevel(Level.DEBUG);
            }

            for (final String name : this.mandatory) {
                if (!cmd.hasOption(name)) {
                    throw new Exception("Missing mandatory option --" + name);
                }
            }

            // Each occurrence of a repeated option is a separate Option object
            final Set<String> present = Sets.newHashSet();
            final ListMultimap<String, String> values = ArrayListMultimap.create();
            for (final Option option : cmd.getOptions()) {
                final String name = option.getLongOpt();
                final String[] strings = MoreObjects.firstNonNull(option.getValues(),
                        new String[0]);
                final Type type = this.types.get(name);
                for (final String string : strings) {
                    if (type != null && !type.validate(string)) {
                        throw new Exception("Invalid value for option --" + name + ": " + string);
                    }
                }
                present.add(name);
                values.putAll(name, Arrays.asList(strings));
                if (option.getOpt() != null) {
                    present.add(option.getOpt());
                    values.putAll(option.getOpt(), Arrays.asList(strings));
                }
            }
            if (!cmd.getArgList().isEmpty()) {
                throw new Exception("Unexpected arguments: " + cmd.getArgList());
            }
            return new CommandLine(present, values);
        }

        private void printVersion() {
            String version = "(development)";
            final URL url = CommandLine.class.getClassLoader().getResource(VERSION_RESOURCE);
            if (url != null) {
                try (InputStream stream = url.openStream()) {
                    final Properties properties = new Properties();
                    properties.load(stream);
                    version = MoreObjects.firstNonNull(properties.getProperty("version"),
                            version).trim();
                } catch (final IOException ex) {
                    version = "(unknown)";
                }
            }
            System.out.println(this.name + " " + version + "\nJava "
                    + System.getProperty("java.version") + " (" + System.getProperty("java.vendor")
                    + ")");
        }

        private void printHelp(final Options options) {
            final HelpFormatter formatter = new HelpFormatter();
            final PrintWriter out = new PrintWriter(System.out);
            formatter.printUsage(out, 100, this.name, options);
            if (this.header != null) {
                out.println();
                formatter.printWrapped(out, 100, this.header);
            }
            out.println();
            formatter.printOptions(out, 100, options, 2, 2);
            if (this.footer != null) {
                out.println();
                out.println(this.footer);
            }
            out.flush();
        }

    }

    /**
     * Signals an invalid command line, or a request to terminate after printing help or version
     * information (in which case there is no message).
     */
    public static final class Exception extends RuntimeException {

        private static final long serialVersionUID = 1L;

        public Exception(@Nullable final String message) {
            super(message);
        }

        public Exception(@Nullable final String message, @Nullable final Throwable cause) {
            super(message, cause);
        }

    }

    /**
     * The types option values are validated against.
     */
    public enum Type {

        STRING,

        FILE_EXISTING;

        public boolean validate(final String value) {
            return this != FILE_EXISTING || new File(value).isFile();
        }

    }

}
