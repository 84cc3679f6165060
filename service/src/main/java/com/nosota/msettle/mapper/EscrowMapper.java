package com.nosota.msettle.mapper;

import com.nosota.msettle.api.response.EscrowResponse;
import com.nosota.msettle.model.Escrow;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

import java.util.List;

@Mapper
public interface EscrowMapper {

    EscrowMapper INSTANCE = Mappers.getMapper(EscrowMapper.class);

    EscrowResponse toResponse(Escrow escrow);

    List<EscrowResponse> toResponseList(List<Escrow> escrows);
}
