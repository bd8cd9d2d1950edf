package dev.reciperunner;

import dev.reciperunner.cli.RecipeRunnerCli;
import picocli.CommandLine;

public class Main {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new RecipeRunnerCli()).execute(args);
        System.exit(exitCode);
    }
}
