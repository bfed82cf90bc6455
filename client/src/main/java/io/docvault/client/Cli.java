// file: client/src/main/java/io/docvault/client/Cli.java
package io.docvault.client;

import io.docvault.core.Document;
import io.docvault.core.InMemoryIndexEngine;
import io.docvault.persistence.DocumentCodec;
import io.docvault.persistence.PersistOutcome;
import io.docvault.persistence.Persistence;
import io.docvault.persistence.PersistenceConfig;
import io.docvault.persistence.PersistenceException;
import io.docvault.persistence.StoreConnector;
import io.docvault.storage.FileKvEngine;
import io.docvault.storage.KvDatabase;
import io.docvault.storage.KvEngineException;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.CompletionException;

/**
 * Offline tool for inspecting and compacting a collection stored by {@link FileKvEngine}.
 *
 * Usage:
 *   docvault-cli --dir <root> --db <name> --store <name> keys
 *   docvault-cli --dir <root> --db <name> --store <name> dump
 *   docvault-cli --dir <root> --db <name> --store <name> compact
 *   docvault-cli --dir <root> --db <name> --store <name> info
 *
 * Every command fails when the database or the store does not exist; none of
 * them creates one.
 */
public final class Cli {

    private static final String USAGE = """
            Usage:
              docvault-cli --dir <root> --db <name> --store <name> keys
              docvault-cli --dir <root> --db <name> --store <name> dump
              docvault-cli --dir <root> --db <name> --store <name> compact
              docvault-cli --dir <root> --db <name> --store <name> info
            """;

    private static final Set<String> COMMANDS = Set.of("keys", "dump", "compact", "info");

    private final Path dir;
    private final PersistenceConfig config;
    private final PrintStream out;

    private Cli(Path dir, PersistenceConfig config, PrintStream out) {
        this.dir = dir;
        this.config = config;
        this.out = out;
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /** Runs one command and returns the process exit code. */
    static int run(String[] args, PrintStream out, PrintStream err) {
        Args parsed;
        try {
            parsed = Args.parse(args);
        } catch (CliException e) {
            err.println("error: " + e.getMessage());
            err.print(USAGE);
            return 1;
        }

        Cli cli = new Cli(parsed.dir, PersistenceConfig.of(parsed.db, parsed.store), out);
        try {
            if (!COMMANDS.contains(parsed.command)) {
                throw new CliException("unknown command: " + parsed.command);
            }
            cli.requireStore();
            switch (parsed.command) {
                case "keys" -> cli.keys();
                case "dump" -> cli.dump();
                case "compact" -> cli.compact();
                case "info" -> cli.info();
                default -> throw new CliException("unknown command: " + parsed.command);
            }
            return 0;
        } catch (CliException | PersistenceException | KvEngineException e) {
            err.println("error: " + e.getMessage());
            return 1;
        } catch (CompletionException e) {
            err.println("error: " + e.getCause().getMessage());
            return 1;
        } catch (RuntimeException e) {
            e.printStackTrace(err);
            return 2;
        }
    }

    /** Fails unless the database and the store already exist. Opening never upgrades here. */
    private void requireStore() {
        try (var engine = new FileKvEngine(dir)) {
            KvDatabase db = engine.open(config.databaseName(), null, upgrade -> {
                throw new CliException("no database '" + config.databaseName() + "' under " + dir);
            }).join();
            try {
                if (!db.storeNames().contains(config.storeName())) {
                    throw new CliException("no store '" + config.storeName() + "' in database "
                            + config.databaseName() + " (stores: " + String.join(", ", db.storeNames()) + ")");
                }
            } finally {
                db.close();
            }
        }
    }

    private void keys() {
        InMemoryIndexEngine collection = load();
        collection.ids().forEach(out::println);
    }

    private void dump() {
        InMemoryIndexEngine collection = load();
        DocumentCodec codec = new DocumentCodec();
        for (Document doc : collection.getAllData()) {
            out.println(codec.toJson(doc));
        }
    }

    private void compact() {
        InMemoryIndexEngine collection = new InMemoryIndexEngine();
        try (var engine = new FileKvEngine(dir);
             var persistence = new Persistence(config, engine, collection)) {
            persistence.loadDatabase().join();
            PersistOutcome outcome = persistence.persistCachedDatabase().join();
            out.printf("compacted %s/%s: %d written, %d deleted%n",
                    config.databaseName(), config.storeName(), outcome.written(), outcome.deleted());
        }
    }

    private void info() {
        InMemoryIndexEngine collection = new InMemoryIndexEngine();
        try (var engine = new FileKvEngine(dir);
             var persistence = new Persistence(config, engine, collection);
             var connector = new StoreConnector(engine)) {
            int count = persistence.loadDatabase().join();
            KvDatabase db = connector.ensureStore(config.databaseName(), config.storeName()).join();
            out.printf("database: %s%nversion:  %d%nstores:   %s%ndocuments in %s: %d%n",
                    db.name(), db.version(), String.join(", ", db.storeNames()), config.storeName(), count);
        }
    }

    private InMemoryIndexEngine load() {
        InMemoryIndexEngine collection = new InMemoryIndexEngine();
        try (var engine = new FileKvEngine(dir);
             var persistence = new Persistence(config, engine, collection)) {
            persistence.loadDatabase().join();
        }
        return collection;
    }

    /** Hand-parsed command line: three required flags in any order, then one command. */
    static final class Args {
        Path dir;
        String db;
        String store;
        String command;

        static Args parse(String[] args) {
            Args a = new Args();
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--dir" -> a.dir = Path.of(value(args, ++i, arg));
                    case "--db" -> a.db = value(args, ++i, arg);
                    case "--store" -> a.store = value(args, ++i, arg);
                    default -> {
                        if (arg.startsWith("--")) throw new CliException("unknown option: " + arg);
                        if (a.command != null) throw new CliException("unexpected argument: " + arg);
                        a.command = arg;
                    }
                }
            }
            if (a.dir == null) throw new CliException("--dir is required");
            if (a.db == null) throw new CliException("--db is required");
            if (a.store == null) throw new CliException("--store is required");
            if (a.command == null) throw new CliException("missing command");
            return a;
        }

        private static String value(String[] args, int i, String flag) {
            if (i >= args.length) throw new CliException(flag + " requires a value");
            return args[i];
        }
    }

    static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
