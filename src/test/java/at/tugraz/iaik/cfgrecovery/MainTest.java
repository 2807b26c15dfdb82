package at.tugraz.iaik.cfgrecovery;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.util.List;

import static org.junit.Assert.*;

public class MainTest {
  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  @Test
  public void collectsListingsRecursively() throws Exception {
    folder.newFile("a.jir");
    folder.newFile("readme.txt");
    folder.newFolder("nested");
    folder.newFile("nested/b.jir");

    List<File> programs = Main.collectPrograms(folder.getRoot());

    assertEquals(2, programs.size());
    for (File program : programs)
      assertTrue(program.getName().endsWith(".jir"));
  }

  @Test
  public void singleFileIsTakenAsIs() throws Exception {
    File file = folder.newFile("single.txt");

    assertEquals(1, Main.collectPrograms(file).size());
  }

  @Test
  public void missingPathYieldsNothing() {
    assertTrue(Main.collectPrograms(new File(folder.getRoot(), "missing")).isEmpty());
  }
}
