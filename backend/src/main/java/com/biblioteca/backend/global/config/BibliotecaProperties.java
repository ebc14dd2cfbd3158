package com.biblioteca.backend.global.config;

import java.math.BigDecimal;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "biblioteca")
public class BibliotecaProperties {

    private final Loans loans = new Loans();
    private final Reservations reservations = new Reservations();
    private final Bootstrap bootstrap = new Bootstrap();

    public Loans getLoans() {
        return loans;
    }

    public Reservations getReservations() {
        return reservations;
    }

    public Bootstrap getBootstrap() {
        return bootstrap;
    }

    public static class Loans {
        private int defaultDays = 14;
        private int renewalDays = 7;
        private int maxRenewals = 2;
        private int maxActive = 3;
        private BigDecimal dailyFine = new BigDecimal("5.00");
        private BigDecimal maxFineToBorrow = BigDecimal.ZERO;

        public int getDefaultDays() {
            return defaultDays;
        }

        public void setDefaultDays(int defaultDays) {
            this.defaultDays = defaultDays;
        }

        public int getRenewalDays() {
            return renewalDays;
        }

        public void setRenewalDays(int renewalDays) {
            this.renewalDays = renewalDays;
        }

        public int getMaxRenewals() {
            return maxRenewals;
        }

        public void setMaxRenewals(int maxRenewals) {
            this.maxRenewals = maxRenewals;
        }

        public int getMaxActive() {
            return maxActive;
        }

        public void setMaxActive(int maxActive) {
            this.maxActive = maxActive;
        }

        public BigDecimal getDailyFine() {
            return dailyFine;
        }

        public void setDailyFine(BigDecimal dailyFine) {
            this.dailyFine = dailyFine;
        }

        public BigDecimal getMaxFineToBorrow() {
            return maxFineToBorrow;
        }

        public void setMaxFineToBorrow(BigDecimal maxFineToBorrow) {
            this.maxFineToBorrow = maxFineToBorrow;
        }
    }

    public static class Reservations {
        private int holdHours = 48;

        public int getHoldHours() {
            return holdHours;
        }

        public void setHoldHours(int holdHours) {
            this.holdHours = holdHours;
        }
    }

    public static class Bootstrap {
        private final Admin admin = new Admin();

        public Admin getAdmin() {
            return admin;
        }
    }

    public static class Admin {
        private String correo;
        private String password;
        private String nombre = "Administrador";
        private String apellido = "Sistema";

        public String getCorreo() {
            return correo;
        }

        public void setCorreo(String correo) {
            this.correo = correo;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public String getNombre() {
            return nombre;
        }

        public void setNombre(String nombre) {
            this.nombre = nombre;
        }

        public String getApellido() {
            return apellido;
        }

        public void setApellido(String apellido) {
            this.apellido = apellido;
        }
    }
}
