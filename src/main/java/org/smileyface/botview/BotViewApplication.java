package org.smileyface.botview;

import org.smileyface.botview.config.FetcherProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(FetcherProperties.class)
public class BotViewApplication {

	public static void main(String[] args) {
		SpringApplication.run(BotViewApplication.class, args);
	}
}
