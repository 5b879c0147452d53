package com.jentfoo.imagebatch;

import java.io.File;
import java.io.IOException;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Keeps the session snapshot as a JSON file.  Each save writes a temp file and renames it over 
 * the previous snapshot.
 */
public class JsonCheckpointStore implements CheckpointStore {
  public static final String STATE_FILE_NAME = "conversion_state.json";

  private final File stateFile;
  private final ObjectMapper mapper;

  public JsonCheckpointStore(File stateFolder) {
    this.stateFile = new File(stateFolder, STATE_FILE_NAME);
    this.mapper = new ObjectMapper();
    mapper.registerModule(new JavaTimeModule());
    mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
    mapper.enable(SerializationFeature.INDENT_OUTPUT);
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  public File getStateFile() {
    return stateFile;
  }

  @Override
  public void save(SessionState state) throws IOException {
    File tempFile = FileUtils.makeTempFile(stateFile);
    boolean moved = false;
    try {
      mapper.writeValue(tempFile, state);
      FileUtils.moveIntoPlace(tempFile, stateFile);
      moved = true;
    } finally {
      if (! moved && tempFile.exists() && ! tempFile.delete()) {
        tempFile.deleteOnExit();
      }
    }
  }

  @Override
  public SessionState load() throws IOException {
    if (! stateFile.exists()) {
      return null;
    }

    return mapper.readValue(stateFile, SessionState.class);
  }

  @Override
  public void clear() throws IOException {
    if (stateFile.exists() && ! stateFile.delete()) {
      throw new IOException("Could not delete state file: " + stateFile.getAbsolutePath());
    }
  }
}
