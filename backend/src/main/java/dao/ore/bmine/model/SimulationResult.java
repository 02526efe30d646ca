package dao.ore.bmine.model;

import java.util.List;

public record SimulationResult(String error, List<String> logs) {

    public boolean isSuccess() {
        return error == null;
    }
}
