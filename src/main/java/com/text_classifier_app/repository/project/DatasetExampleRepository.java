package com.text_classifier_app.repository.project;

import com.text_classifier_app.entity.project.DatasetExample;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DatasetExampleRepository extends JpaRepository<DatasetExample, Long> {

    List<DatasetExample> findByProjectIdOrderByIdAsc(String projectId);
}
