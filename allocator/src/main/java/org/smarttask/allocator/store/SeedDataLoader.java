package org.smarttask.allocator.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.smarttask.allocator.api.DtoMapper;
import org.smarttask.allocator.api.JsonMapperFactory;
import org.smarttask.allocator.api.dto.TeamStateDto;
import org.smarttask.allocator.domain.model.TeamState;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Loads an initial team state from a JSON file with {@code members} and {@code tasks} arrays.
 */
public final class SeedDataLoader {

    private static final Logger LOG = Logger.getLogger(SeedDataLoader.class.getName());

    public static final String DEFAULT_RESOURCE = "seed-data.json";

    private final ObjectMapper mapper = JsonMapperFactory.create();

    /**
     * Load seed data bundled on the classpath.
     */
    public TeamState loadResource(String resourceName) throws IOException {
        try (InputStream in = SeedDataLoader.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in == null) {
                throw new IOException("Seed resource not found: " + resourceName);
            }
            return parse(in, resourceName);
        }
    }

    /**
     * Load seed data from a file on disk.
     */
    public TeamState loadFile(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return parse(in, path.toString());
        }
    }

    private TeamState parse(InputStream in, String source) throws IOException {
        TeamStateDto dto = mapper.readValue(in, TeamStateDto.class);
        TeamState state;
        try {
            state = DtoMapper.toTeamState(dto);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid seed data in " + source + ": " + e.getMessage(), e);
        }
        LOG.info(() -> String.format("Loaded %d members and %d tasks from %s",
                state.getMembers().size(), state.getTasks().size(), source));
        return state;
    }
}
