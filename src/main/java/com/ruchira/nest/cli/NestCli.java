package com.ruchira.nest.cli;

import com.ruchira.nest.NestApplication;
import org.springframework.boot.Banner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

import static com.ruchira.nest.constant.Constants.CLI_PROFILE;

/**
 * Command-line entry point: starts the application without a web server and exits
 * with the status reported by {@link NestCommandLineRunner}.
 */
public class NestCli {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = new SpringApplicationBuilder(NestApplication.class)
                .web(WebApplicationType.NONE)
                .bannerMode(Banner.Mode.OFF)
                .logStartupInfo(false)
                .profiles(CLI_PROFILE)
                .run(args);

        System.exit(SpringApplication.exit(context));
    }
}
