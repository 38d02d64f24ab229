/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.cowdb.cli;

import dev.mars.cowdb.CowDb;
import dev.mars.cowdb.storage.StorageConfig;
import dev.mars.cowdb.storage.StorageException;
import dev.mars.cowdb.tree.KeyNotFoundException;

import java.io.PrintStream;
import java.nio.file.Path;

/**
 * Command-line access to a cowdb file.
 *
 * <h2>Usage</h2>
 * <pre>
 * cowdb &lt;file&gt; get &lt;key&gt;
 * cowdb &lt;file&gt; set &lt;key&gt; &lt;value&gt;
 * cowdb &lt;file&gt; delete &lt;key&gt;
 * cowdb &lt;file&gt; contains &lt;key&gt;
 * </pre>
 * {@code set} and {@code delete} commit before exiting.
 *
 * <h2>Exit Codes</h2>
 * <ul>
 *   <li>0 - success</li>
 *   <li>1 - usage error, or the key does not exist</li>
 *   <li>2 - the file could not be read or written</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 * Resolved by {@link StorageConfig#load()}: system properties
 * ({@code -Dcowdb.lockTimeoutMs=5000}), environment variables
 * ({@code COWDB_LOCK_TIMEOUT_MS}), {@code cowdb.properties}, defaults.
 * <pre>
 * # Build
 * mvn package -pl cowdb-cli -am
 *
 * # Run
 * java -cp "cowdb-cli/target/*:..." dev.mars.cowdb.cli.CowDbTool data.cowdb set greeting hello
 * </pre>
 */
public final class CowDbTool {

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE_OR_MISSING = 1;
    static final int EXIT_STORAGE_ERROR = 2;

    private static final String USAGE = "Usage: cowdb <file> <get|set|delete|contains> <key> [<value>]";

    private CowDbTool() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Runs one command.
     *
     * @return the process exit code
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length < 3) {
            return usage(err, "missing arguments");
        }

        Path file = Path.of(args[0]);
        String verb = args[1];
        String key = args[2];

        int expectedArgs = switch (verb) {
            case "get", "delete", "contains" -> 3;
            case "set" -> 4;
            default -> -1;
        };
        if (expectedArgs < 0) {
            return usage(err, "unknown command: " + verb);
        }
        if (args.length != expectedArgs) {
            return usage(err, verb + " takes " + (expectedArgs - 2) + " argument(s)");
        }

        try (CowDb<String, String> db = CowDb.connect(file, StorageConfig.load())) {
            return switch (verb) {
                case "get" -> {
                    out.println(db.get(key));
                    yield EXIT_OK;
                }
                case "set" -> {
                    db.set(key, args[3]);
                    db.commit();
                    out.println("Set " + key + " in " + file);
                    yield EXIT_OK;
                }
                case "delete" -> {
                    db.delete(key);
                    db.commit();
                    out.println("Deleted " + key + " from " + file);
                    yield EXIT_OK;
                }
                default -> {
                    boolean present = db.contains(key);
                    out.println(present);
                    yield present ? EXIT_OK : EXIT_USAGE_OR_MISSING;
                }
            };
        } catch (KeyNotFoundException e) {
            err.println("Error: key '" + key + "' does not exist in " + file);
            return EXIT_USAGE_OR_MISSING;
        } catch (StorageException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_STORAGE_ERROR;
        }
    }

    private static int usage(PrintStream err, String problem) {
        err.println("Error: " + problem);
        err.println(USAGE);
        return EXIT_USAGE_OR_MISSING;
    }
}
