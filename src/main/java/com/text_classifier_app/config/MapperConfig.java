package com.text_classifier_app.config;

import com.text_classifier_app.dto.training.TrainingJobDTO;
import com.text_classifier_app.entity.TrainingJob;
import org.modelmapper.ModelMapper;
import org.modelmapper.config.Configuration.AccessLevel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MapperConfig {

    @Bean
    public ModelMapper modelMapper() {
        ModelMapper modelMapper = new ModelMapper();

        modelMapper.getConfiguration()
                .setFieldMatchingEnabled(true)
                .setFieldAccessLevel(AccessLevel.PRIVATE)
                .setSkipNullEnabled(true)
                .setAmbiguityIgnored(true);

        // config and result are immutable snapshots; hand them over as-is instead of deep-copying
        modelMapper.createTypeMap(TrainingJob.class, TrainingJobDTO.class)
                .addMappings(mapper -> {
                    mapper.map(TrainingJob::getConfig, TrainingJobDTO::setConfig);
                    mapper.map(TrainingJob::getResult, TrainingJobDTO::setResult);
                });

        return modelMapper;
    }
}
