package com.eyelevel.docpipeline.repository;

import com.eyelevel.docpipeline.model.Document;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Spring Data JPA repository for the {@link Document} entity.
 */
@Repository
public interface DocumentRepository extends JpaRepository<Document, String> {
}
