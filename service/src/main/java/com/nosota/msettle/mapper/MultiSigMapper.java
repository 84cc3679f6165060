package com.nosota.msettle.mapper;

import com.nosota.msettle.api.response.PendingTransactionResponse;
import com.nosota.msettle.api.response.WalletResponse;
import com.nosota.msettle.model.MultiSigWallet;
import com.nosota.msettle.model.PendingTransaction;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.factory.Mappers;

/**
 * MapStruct mapper for multi-sig wallets and their pending transactions.
 */
@Mapper
public interface MultiSigMapper {

    MultiSigMapper INSTANCE = Mappers.getMapper(MultiSigMapper.class);

    /**
     * Maps a wallet together with its custody balance, which lives in the ledger, not the entity.
     *
     * @param wallet  Wallet entity
     * @param balance Native balance of the wallet's system account
     * @return WalletResponse
     */
    @Mapping(target = "balance", source = "balance")
    WalletResponse toResponse(MultiSigWallet wallet, Long balance);

    PendingTransactionResponse toResponse(PendingTransaction transaction);
}
