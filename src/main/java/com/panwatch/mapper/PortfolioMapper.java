package com.panwatch.mapper;

import com.panwatch.domain.model.Account;
import com.panwatch.domain.model.Position;
import com.panwatch.entity.AccountEntity;
import com.panwatch.entity.PositionEntity;
import java.util.List;
import org.mapstruct.Mapper;

/** MapStruct mapper for brokerage accounts and their positions. */
@Mapper
public interface PortfolioMapper {

    AccountEntity toEntity(Account account);

    Account toDomain(AccountEntity entity);

    List<Account> toAccountList(List<AccountEntity> entities);

    PositionEntity toEntity(Position position);

    Position toDomain(PositionEntity entity);
}
