package dev.fathom.fixture;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a small Java project to a temporary directory.
 *
 * <p>{@code Main.greet} has its body on lines 10 to 15 of {@code Main.java}.
 */
public final class SampleProject {

  public static final String MAIN_RELATIVE_PATH = "src/main/java/com/example/Main.java";

  public static final String MAIN_SOURCE =
      """
      package com.example;

      public class Main {

          public static void main(String[] args) {
              System.out.println("Hello from the sample Java project!");
              greet("Fathom");
          }

          public static String greet(String name) {
              if (name == null || name.isBlank()) {
                  return "Hello, stranger!";
              }
              return "Hello, " + name + "!";
          }

          private void helperMethod() {
              System.err.println("This is a private helper method.");
          }
      }
      """;

  private SampleProject() {}

  /** Creates the project under {@code root} and returns the path of {@code Main.java}. */
  public static Path create(Path root) throws IOException {
    return write(root, MAIN_RELATIVE_PATH, MAIN_SOURCE);
  }

  public static Path write(Path root, String relativePath, String content) throws IOException {
    Path file = root.resolve(relativePath);
    Files.createDirectories(file.getParent());
    return Files.writeString(file, content);
  }
}
