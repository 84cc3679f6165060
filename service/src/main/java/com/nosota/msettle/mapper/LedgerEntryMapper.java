package com.nosota.msettle.mapper;

import com.nosota.msettle.api.dto.LedgerEntryDTO;
import com.nosota.msettle.model.LedgerEntry;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

import java.util.List;

/**
 * MapStruct mapper for LedgerEntry entity to LedgerEntryDTO conversion.
 */
@Mapper
public interface LedgerEntryMapper {

    LedgerEntryMapper INSTANCE = Mappers.getMapper(LedgerEntryMapper.class);

    LedgerEntryDTO toDTO(LedgerEntry entry);

    List<LedgerEntryDTO> toDTOList(List<LedgerEntry> entries);
}
