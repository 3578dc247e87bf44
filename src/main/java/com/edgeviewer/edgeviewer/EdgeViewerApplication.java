package com.edgeviewer.edgeviewer;

import org.bytedeco.javacv.FFmpegLogCallback;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class EdgeViewerApplication {

	public static void main(String[] args) {
		// Route FFmpeg's native log through JavaCV for readable capture errors
		FFmpegLogCallback.set();

		SpringApplication.run(EdgeViewerApplication.class, args);
	}

}
