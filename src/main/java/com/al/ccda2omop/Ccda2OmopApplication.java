package com.al.ccda2omop;

import com.al.ccda2omop.cli.ConversionCommand;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import picocli.CommandLine;

@SpringBootApplication
public class Ccda2OmopApplication {

	public static void main(String[] args) {
		ConversionCommand command = new ConversionCommand(Ccda2OmopApplication.class);
		int exit = new CommandLine(command).execute(args);
		if (exit != 0 || command.isCommandLineRun()) {
			System.exit(exit);
		}
	}

}
