package com.escada.rentbot.db;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reference city with its aliases, loaded from {@code cities.csv} on the classpath.
 * <p>
 * Line format: {@code code;name_uk;channel_url;alias1|alias2|...}. Empty channel means the city
 * has no channel yet. Code and name are always aliases too.
 */
public final class CitySeed {
    public static final String RESOURCE = "/cities.csv";

    public final String code;
    public final String nameUk;
    public final String channelUrl;
    public final List<String> aliases;

    public CitySeed(String code, String nameUk, String channelUrl, List<String> aliases) {
        this.code = code;
        this.nameUk = nameUk;
        this.channelUrl = channelUrl;
        Set<String> all = new LinkedHashSet<>();
        all.add(nameUk);
        all.addAll(aliases);
        all.add(code);
        this.aliases = List.copyOf(all);
    }

    public static List<CitySeed> load() {
        try (InputStream in = CitySeed.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + RESOURCE);
            }
            return parse(new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8)));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + RESOURCE, e);
        }
    }

    static List<CitySeed> parse(BufferedReader reader) throws IOException {
        List<CitySeed> seeds = new ArrayList<>();
        String line;
        int lineNo = 0;
        while ((line = reader.readLine()) != null) {
            lineNo++;
            String l = line.strip();
            if (l.isEmpty() || l.startsWith("#")) continue;

            String[] parts = l.split(";", -1);
            if (parts.length < 2 || parts[0].isBlank() || parts[1].isBlank()) {
                throw new IllegalStateException("Bad city line " + lineNo + ": " + line);
            }
            String channel = parts.length > 2 && !parts[2].isBlank() ? parts[2].strip() : null;
            List<String> aliases = new ArrayList<>();
            if (parts.length > 3) {
                for (String a : parts[3].split("\\|")) {
                    if (!a.isBlank()) aliases.add(a.strip());
                }
            }
            seeds.add(new CitySeed(parts[0].strip(), parts[1].strip(), channel, aliases));
        }
        return seeds;
    }

    /**
     * Case-insensitive key used for alias matching. Done in Java because SQLite's lower() only
     * folds ASCII.
     */
    public static String normalizeAlias(String alias) {
        return alias.strip()
                .replace('’', '\'')
                .replace('ʼ', '\'')
                .replace('`', '\'')
                .toLowerCase(Locale.ROOT);
    }
}
