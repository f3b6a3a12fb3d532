package com.db.vf2pp;

import com.db.vf2pp.config.AppConfig;
import com.db.vf2pp.process.MatchProcess;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.time.LocalDateTime;

@SpringBootApplication
public class Vf2ppApplication implements CommandLineRunner {
    private static final Logger logger = LoggerFactory.getLogger(Vf2ppApplication.class);

    @Autowired
    private MatchProcess matchProcess;

    @Autowired
    private AppConfig config;

    public static void main(String[] args) {
        SpringApplication.run(Vf2ppApplication.class, args);
    }

    @Override
    public void run(String... args) {
        logger.info("Start matching in {} mode at {}", config.getMode(), LocalDateTime.now());
        matchProcess.start();
        logger.info("Finish matching at {}", LocalDateTime.now());
    }
}
