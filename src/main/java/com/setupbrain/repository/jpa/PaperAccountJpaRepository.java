package com.setupbrain.repository.jpa;

import com.setupbrain.entity.PaperAccountEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PaperAccountJpaRepository extends JpaRepository<PaperAccountEntity, Long> {}
