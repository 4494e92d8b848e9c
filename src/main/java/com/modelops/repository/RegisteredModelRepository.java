package com.modelops.repository;

import com.modelops.entity.RegisteredModel;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface RegisteredModelRepository extends JpaRepository<RegisteredModel, String> {

    List<RegisteredModel> findAllByOrderByNameAsc();
}
