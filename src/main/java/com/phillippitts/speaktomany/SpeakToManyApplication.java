package com.phillippitts.speaktomany;

import com.phillippitts.speaktomany.config.properties.RecognitionProperties;
import com.phillippitts.speaktomany.config.properties.RecognizerWatchdogProperties;
import com.phillippitts.speaktomany.config.properties.SynthesisProperties;
import com.phillippitts.speaktomany.config.properties.TranslationBufferProperties;
import com.phillippitts.speaktomany.config.properties.TranslationServiceProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        TranslationBufferProperties.class,
        RecognitionProperties.class,
        RecognizerWatchdogProperties.class,
        TranslationServiceProperties.class,
        SynthesisProperties.class
})
@EnableScheduling
public class SpeakToManyApplication {

    public static void main(String[] args) {
        SpringApplication.run(SpeakToManyApplication.class, args);
    }

}
