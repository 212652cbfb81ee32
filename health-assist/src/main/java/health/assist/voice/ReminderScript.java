package health.assist.voice;

public record ReminderScript(
        String patientName,
        String caregiverName,
        String medicineName,
        String dosage,
        String scheduledTime,
        String dateKey,
        String mode
) {
    public ReminderScript {
        patientName = orDefault(patientName, "patient");
        caregiverName = orDefault(caregiverName, "caregiver");
        medicineName = orDefault(medicineName, "medicine");
        dosage = orDefault(dosage, "as prescribed");
        scheduledTime = orDefault(scheduledTime, "now");
        dateKey = orDefault(dateKey, "today");
        mode = orDefault(mode, "caregiver_patient");
    }

    public String intro() {
        if ("self_patient".equals(mode)) {
            return "This is an automated medicine reminder. It is time to take " + medicineName + ", "
                    + dosage + ", at " + scheduledTime + " on " + dateKey + ".";
        }
        return "This is an automated call set by " + caregiverName + ". Hello " + patientName
                + ", it is time to take " + medicineName + ", " + dosage + ", at " + scheduledTime
                + " on " + dateKey + ".";
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }
}
