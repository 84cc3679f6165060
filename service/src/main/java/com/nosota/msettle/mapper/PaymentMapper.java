package com.nosota.msettle.mapper;

import com.nosota.msettle.api.dto.PaymentLegDTO;
import com.nosota.msettle.api.response.PaymentResponse;
import com.nosota.msettle.model.Payment;
import com.nosota.msettle.model.PaymentLeg;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

import java.util.List;

@Mapper
public interface PaymentMapper {

    PaymentMapper INSTANCE = Mappers.getMapper(PaymentMapper.class);

    PaymentResponse toResponse(Payment payment);

    List<PaymentResponse> toResponseList(List<Payment> payments);

    PaymentLegDTO toDTO(PaymentLeg leg);
}
