package dev.codesearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the code search MCP server.
 *
 * <p>Runs without a web server and talks MCP over stdio, so stdout carries protocol frames only
 * and logs go to a file.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class CodeSearchApplication {
  public static void main(String[] args) {
    SpringApplication.run(CodeSearchApplication.class, args);
  }
}
