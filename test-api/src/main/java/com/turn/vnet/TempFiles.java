package com.turn.vnet;

import org.apache.commons.io.FileUtils;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Temporary directories for tests that need real files. Everything created
 * here is removed by {@link #cleanup()}.
 */
public class TempFiles {

  private static final Random ourRandom = new Random();

  private final File myBaseDir = FileUtils.getTempDirectory();
  private final List<File> myFilesToDelete = new ArrayList<File>();

  public File createTempDir() throws IOException {
    if (!myBaseDir.isDirectory()) {
      throw new IllegalStateException("Temp directory is not a directory: " + myBaseDir.getAbsolutePath());
    }
    while (true) {
      File dir = new File(myBaseDir, "vnet-test" + ourRandom.nextInt(Integer.MAX_VALUE));
      if (!dir.exists() && dir.mkdirs()) {
        File canonical = dir.getCanonicalFile();
        myFilesToDelete.add(canonical);
        return canonical;
      }
    }
  }

  public File createTempFile(byte[] content) throws IOException {
    File file = new File(createTempDir(), "data.bin");
    FileUtils.writeByteArrayToFile(file, content);
    return file;
  }

  public void cleanup() {
    for (File file : myFilesToDelete) {
      FileUtils.deleteQuietly(file);
    }
    myFilesToDelete.clear();
  }
}
