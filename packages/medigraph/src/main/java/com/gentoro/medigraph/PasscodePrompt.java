package com.gentoro.medigraph;

import com.gentoro.medigraph.exception.ConfigurationException;
import java.io.BufferedReader;
import java.io.Console;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/** Collects the source's one-time passcode from the operator. */
@FunctionalInterface
public interface PasscodePrompt {

  String read(String prompt);

  /** Hidden input on a terminal; a plain line from stdin when there is no console. */
  static PasscodePrompt console() {
    return prompt -> {
      Console console = System.console();
      if (console != null) {
        char[] chars = console.readPassword("%s", prompt);
        return chars == null ? null : new String(chars);
      }
      System.out.print(prompt);
      System.out.flush();
      try {
        return new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))
            .readLine();
      } catch (IOException e) {
        throw new ConfigurationException("Unable to read passcode: " + e.getMessage(), e);
      }
    };
  }
}
