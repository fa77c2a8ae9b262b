/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

package dev.mars.trapfs.protocol;

import dev.mars.trapfs.core.exceptions.OperationNotImplementedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Maps protocol command names to jail operations.
 *
 * <p>Lookups ignore case and collapse runs of whitespace, so {@code "site  chmod"}
 * finds {@code SITE CHMOD}. A command that is not registered is reported as
 * {@link OperationNotImplementedException}.</p>
 */
public class CommandAliasTable {
    private static final Logger logger = LoggerFactory.getLogger(CommandAliasTable.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Map<String, JailOperation> aliases = new ConcurrentHashMap<>();

    /**
     * An empty table. See {@link #ftpDefaults()} for the usual FTP command set.
     */
    public CommandAliasTable() {
    }

    /**
     * Operation names plus the FTP commands (RFC 959, RFC 3659 and the X-prefixed variants).
     * FTP {@code STAT} with a path argument is a long listing, so it maps to
     * {@link JailOperation#LIST} and shadows the {@code STAT} operation name.
     */
    public static CommandAliasTable ftpDefaults() {
        CommandAliasTable table = new CommandAliasTable();
        table.registerOperationNames();

        table.registerAlias("CWD", JailOperation.CHDIR);
        table.registerAlias("XCWD", JailOperation.CHDIR);
        table.registerAlias("CDUP", JailOperation.CHDIR);
        table.registerAlias("XCUP", JailOperation.CHDIR);
        table.registerAlias("PWD", JailOperation.GETCWD);
        table.registerAlias("XPWD", JailOperation.GETCWD);
        table.registerAlias("LIST", JailOperation.LIST);
        table.registerAlias("STAT", JailOperation.LIST);
        table.registerAlias("NLST", JailOperation.LIST_NAMES);
        table.registerAlias("SIZE", JailOperation.GETSIZE);
        table.registerAlias("MDTM", JailOperation.GETMTIME);
        table.registerAlias("MFMT", JailOperation.UTIME);
        table.registerAlias("SITE CHMOD", JailOperation.CHMOD);
        table.registerAlias("MKD", JailOperation.MAKEDIR);
        table.registerAlias("XMKD", JailOperation.MAKEDIR);
        table.registerAlias("RMD", JailOperation.REMOVEDIR);
        table.registerAlias("XRMD", JailOperation.REMOVEDIR);
        table.registerAlias("DELE", JailOperation.REMOVE);
        table.registerAlias("RNFR", JailOperation.RENAME);
        table.registerAlias("RNTO", JailOperation.RENAME);
        table.registerAlias("RETR", JailOperation.RETRIEVE);
        table.registerAlias("STOR", JailOperation.STORE);
        table.registerAlias("STOU", JailOperation.STORE);
        table.registerAlias("APPE", JailOperation.STORE);

        logger.info("Registered {} FTP command aliases", table.aliases.size());
        return table;
    }

    /**
     * Registers every operation under its own name, e.g. {@code CHDIR}.
     */
    public void registerOperationNames() {
        for (JailOperation operation : JailOperation.values()) {
            registerAlias(operation.name(), operation);
        }
    }

    /**
     * Register an operation under a command name, replacing any previous mapping
     */
    public void registerAlias(String command, JailOperation operation) {
        JailOperation previous = aliases.put(normalize(command), operation);
        if (previous != null && previous != operation) {
            logger.debug("Command alias {} remapped: {} -> {}", command, previous, operation);
        } else {
            logger.debug("Registered command alias: {} -> {}", command, operation);
        }
    }

    public void unregisterAlias(String command) {
        if (command != null && aliases.remove(normalize(command)) != null) {
            logger.debug("Unregistered command alias: {}", command);
        }
    }

    public Optional<JailOperation> lookup(String command) {
        if (command == null || command.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(aliases.get(normalize(command)));
    }

    /**
     * @throws OperationNotImplementedException if the command is not registered
     */
    public JailOperation resolve(String command) throws OperationNotImplementedException {
        return lookup(command).orElseThrow(() -> {
            logger.debug("Unsupported command: {}", command);
            return new OperationNotImplementedException("", String.valueOf(command));
        });
    }

    public boolean isSupported(String command) {
        return lookup(command).isPresent();
    }

    /**
     * @return registered command names, normalized and sorted
     */
    public Set<String> getCommands() {
        return new TreeSet<>(aliases.keySet());
    }

    private static String normalize(String command) {
        String trimmed = command.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Command name must not be blank");
        }
        return WHITESPACE.matcher(trimmed).replaceAll(" ").toUpperCase(Locale.ROOT);
    }
}
