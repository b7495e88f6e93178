package com.text_classifier_app.repository.project;

import com.text_classifier_app.entity.project.ProjectRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ProjectRecordRepository extends JpaRepository<ProjectRecord, String> {
}
