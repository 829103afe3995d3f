package com.setupbrain.mapper;

import com.setupbrain.domain.model.SetupRecord;
import com.setupbrain.entity.SetupRecordEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.MappingTarget;

/**
 * MapStruct mapper between SetupRecord and SetupRecordEntity. 1:1 field mapping.
 */
@Mapper(componentModel = "spring")
public interface SetupRecordMapper {

    SetupRecordEntity toEntity(SetupRecord setupRecord);

    SetupRecord toDomain(SetupRecordEntity entity);

    List<SetupRecord> toDomainList(List<SetupRecordEntity> entities);

    /** Copies mutable fields onto an existing row, keeping its ID. */
    @Mapping(target = "id", ignore = true)
    void updateEntity(SetupRecord setupRecord, @MappingTarget SetupRecordEntity entity);
}
