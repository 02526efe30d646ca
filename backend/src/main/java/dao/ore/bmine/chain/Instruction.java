package dao.ore.bmine.chain;

import dao.ore.bmine.model.PublicKey;

import java.util.List;

/**
 * A single program invocation: the program, the accounts it touches and its opaque data.
 */
public record Instruction(PublicKey programId, List<AccountMeta> accounts, byte[] data) {

    public Instruction {
        accounts = List.copyOf(accounts);
    }
}
